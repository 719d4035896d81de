package com.chesshub.chessservice.platform.transport;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 广播事件（服务端 → 客户端）
 * ---------------------------------------------
 * 所有下行消息的统一外壳。
 * 字段：
 *   - roomId ：所属对局；
 *   - type   ：事件名（如 "move-made"、"game-over"、"error-msg"）；
 *   - payload：事件内容。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastEvent {
    private String roomId;
    private String type;
    private Object payload;
}
