package com.chesshub.chessservice.games.chess.application.dto;

import com.chesshub.chessservice.games.chess.domain.enums.GameOverType;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.model.SessionState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * 下行事件名与载荷定义（服务端 → 客户端）
 * ----------------------------------------
 * 事件名与前端约定一致，载荷由 {@link com.chesshub.chessservice.platform.transport.BroadcastEvent} 包装后推送。
 */
public final class ChessEvents {

    private ChessEvents() {}

    public static final String GAME_STATE = "game-state";
    public static final String GAME_READY = "game-ready";
    public static final String MOVE_MADE = "move-made";
    public static final String MOVE_REJECTED = "move-rejected";
    public static final String PLAYER_CONNECTED = "player-connected";
    public static final String PLAYER_DISCONNECTED = "player-disconnected";
    public static final String DRAW_OFFERED = "draw-offered";
    public static final String DRAW_DECLINED = "draw-declined";
    public static final String GAME_OVER = "game-over";
    public static final String ERROR_MSG = "error-msg";

    /**
     * 完整快照 + 接收方执子颜色与双方名字（只发给刚加入的连接）
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameStatePayload {
        @JsonUnwrapped
        private SessionState state;
        private PlayerColor yourColor;
        private String whiteName;
        private String blackName;
    }

    /** 双方都在线后广播一次 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameReadyPayload {
        private String whiteName;
        private String blackName;
    }

    /**
     * 一步棋被接受后的广播
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MoveMadePayload {
        private String from;
        private String to;
        private String promotion;
        private String san;
        private String fen;
        /** 走后行棋方 */
        private PlayerColor turn;
        private boolean inCheck;
        private int moveNumber;
        /** 被吃的子（小写字母），无则 null */
        private String captured;
        private String piece;
        private Map<String, Set<String>> legalMoves;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MoveRejectedPayload {
        private String error;
    }

    /** 对手上线/掉线通知 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PresencePayload {
        private PlayerColor color;
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DrawOfferedPayload {
        private PlayerColor offeredBy;
    }

    /**
     * 终局广播：终局方式与结果，附双方名字与最新积分
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GameOverPayload {
        private GameOverType type;
        private PlayerColor winner;
        private GameResult result;
        private String reason;
        private String message;
        private String whiteName;
        private String blackName;
        private Integer whiteScore;
        private Integer blackScore;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorPayload {
        private String message;
    }
}
