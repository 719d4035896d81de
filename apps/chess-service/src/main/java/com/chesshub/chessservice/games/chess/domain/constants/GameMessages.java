package com.chesshub.chessservice.games.chess.domain.constants;

/**
 * 国际象棋对局相关的消息常量
 * 统一管理所有客户端可见的提示消息（move-rejected / error-msg / HTTP 错误），避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 落子 ==========

    public static final String NOT_YOUR_TURN = "Not your turn";

    public static final String GAME_NOT_ACTIVE = "Game is not active";

    public static final String ILLEGAL_MOVE = "Illegal move";

    // ========== 加入 / 重连 ==========

    public static final String GAME_NOT_FOUND = "Game not found";

    public static final String GAME_FULL = "Game is full";

    public static final String GAME_ALREADY_STARTED = "Game already started or completed";

    public static final String GAME_ALREADY_COMPLETED = "Game already completed";

    /** HTTP 重连时调用方不是该局玩家 */
    public static final String NOT_IN_GAME = "You are not in this game";

    /** WS join-game 时调用方不是该局玩家 */
    public static final String NOT_A_PLAYER = "Not a player in this game";

    public static final String INVALID_NAME = "Player name is required";

    // ========== 和棋协商 ==========

    public static final String DRAW_ALREADY_OFFERED = "You already offered a draw";

    public static final String NO_DRAW_OFFER = "No draw offer to answer";

    public static final String OWN_DRAW_OFFER = "Cannot answer your own draw offer";

    // ========== 系统 ==========

    /** 持久化或规则引擎异常时对客户端的统一提示（详情只进日志） */
    public static final String INTERNAL_ERROR = "Internal error, please retry";

    /** 黑方未加入时的占位名 */
    public static final String WAITING_NAME = "Waiting...";

    /** 掉线判负的说明，传入掉线方颜色 */
    public static final String PLAYER_DISCONNECTED = "%s player disconnected";

    public static String formatPlayerDisconnected(String color) {
        return String.format(PLAYER_DISCONNECTED, color);
    }
}
