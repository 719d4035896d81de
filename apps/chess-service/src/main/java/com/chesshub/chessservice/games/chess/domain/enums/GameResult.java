package com.chesshub.chessservice.games.chess.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** 终局结果（持久化与 game-over 广播共用同一字符串） */
public enum GameResult {
    WHITE_WINS("white_wins"),
    BLACK_WINS("black_wins"),
    DRAW("draw");

    private final String wire;

    GameResult(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static GameResult winFor(PlayerColor winner) {
        return winner == PlayerColor.WHITE ? WHITE_WINS : BLACK_WINS;
    }

    /** 和棋返回 null */
    public PlayerColor winner() {
        return switch (this) {
            case WHITE_WINS -> PlayerColor.WHITE;
            case BLACK_WINS -> PlayerColor.BLACK;
            case DRAW -> null;
        };
    }

    public PlayerOutcome outcomeFor(PlayerColor color) {
        if (this == DRAW) return PlayerOutcome.DRAW;
        return winner() == color ? PlayerOutcome.WIN : PlayerOutcome.LOSS;
    }

    @JsonCreator
    public static GameResult fromWire(String value) {
        for (GameResult r : values()) {
            if (r.wire.equalsIgnoreCase(value)) return r;
        }
        throw new IllegalArgumentException("unknown result: " + value);
    }
}
