package com.chesshub.chessservice.games.chess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** game-over 事件的 type 字段 */
public enum GameOverType {
    CHECKMATE,
    STALEMATE,
    DRAW,
    DRAW_AGREED,
    RESIGNATION,
    ABANDONMENT;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
