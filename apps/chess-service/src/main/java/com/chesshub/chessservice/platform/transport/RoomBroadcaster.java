package com.chesshub.chessservice.platform.transport;

/**
 * 下行消息出口（与具体传输无关）
 * ----------------------------------------
 * 协议处理器只通过该接口推送事件：
 *   - toRoom   ：对局内所有订阅者；
 *   - toSocket ：某一条连接（按连接ID定向，用于 game-state / 错误 / 对手通知）。
 */
public interface RoomBroadcaster {

    void toRoom(String roomId, String type, Object payload);

    void toSocket(String socketId, String roomId, String type, Object payload);
}
