package com.chesshub.chessservice.games.chess.domain.exception;

import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;

/**
 * 对局操作的业务错误分类（与 HTTP 状态码的映射见 WebExceptionAdvice）
 */
public enum ErrorKind {
    GAME_NOT_FOUND(GameMessages.GAME_NOT_FOUND),
    NOT_A_PLAYER(GameMessages.NOT_IN_GAME),
    NOT_YOUR_TURN(GameMessages.NOT_YOUR_TURN),
    GAME_NOT_ACTIVE(GameMessages.GAME_NOT_ACTIVE),
    ILLEGAL_MOVE(GameMessages.ILLEGAL_MOVE),
    GAME_FULL(GameMessages.GAME_FULL),
    GAME_ALREADY_STARTED(GameMessages.GAME_ALREADY_STARTED),
    GAME_ALREADY_COMPLETED(GameMessages.GAME_ALREADY_COMPLETED);

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /** 状态冲突类错误（HTTP 409） */
    public boolean isConflict() {
        return this == GAME_FULL || this == GAME_ALREADY_STARTED || this == GAME_ALREADY_COMPLETED;
    }
}
