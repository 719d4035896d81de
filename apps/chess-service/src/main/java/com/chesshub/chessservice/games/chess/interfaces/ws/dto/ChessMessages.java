package com.chesshub.chessservice.games.chess.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 入站消息对象定义（客户端 → 服务端）
 * ----------------------------------------
 * 通过 STOMP /app/chess.* 发送；下行事件见 ChessEvents。
 * 认输/和棋类指令没有载荷，连接与对局的绑定在 join-game 时完成。
 */
public class ChessMessages {

    /**
     * 进入对局（绑定当前连接）
     * 字段：
     *   - gameId  ：对局ID；
     *   - playerId：创建/加入/重连时拿到的玩家ID。
     */
    @Data
    public static class JoinGameCmd {
        private String gameId;
        private String playerId;
    }

    /**
     * 落子命令
     * 字段：
     *   - from,to   ：起止格，如 "e2","e4"；
     *   - promotion ：升变子 "q"/"r"/"b"/"n"，可空（默认升后）。
     */
    @Data
    public static class MakeMoveCmd {
        private String from;
        private String to;
        private String promotion;
    }
}
