package com.chesshub.chessservice.games.chess.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局生命周期：只能向前迁移 WAITING → ACTIVE → {COMPLETED, ABANDONED}。
 * ABANDONED 目前不会被赋值（掉线判负记为 COMPLETED + 胜负结果），保留以便后续扩展。
 */
public enum SessionStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
