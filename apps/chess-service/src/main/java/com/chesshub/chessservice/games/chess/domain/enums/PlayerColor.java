package com.chesshub.chessservice.games.chess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** 执子方：白方永远是房主（先手） */
public enum PlayerColor {
    WHITE("white", 'w'),
    BLACK("black", 'b');

    private final String wire;
    private final char fenCode;

    PlayerColor(String wire, char fenCode) {
        this.wire = wire;
        this.fenCode = fenCode;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public char fenCode() {
        return fenCode;
    }

    public PlayerColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    public static PlayerColor fromFenCode(char c) {
        if (c == 'w') return WHITE;
        if (c == 'b') return BLACK;
        throw new IllegalArgumentException("bad side to move: " + c);
    }
}
