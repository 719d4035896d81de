package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 局面判定：进行中 / 将军 / 将死 / 逼和 / 和棋（带原因）。
 */
public record Classification(Kind kind, String reason) {

    public enum Kind { NONE, CHECK, CHECKMATE, STALEMATE, DRAW }

    public static final String FIFTY_MOVE = "fifty-move rule";
    public static final String THREEFOLD = "threefold repetition";
    public static final String INSUFFICIENT_MATERIAL = "insufficient material";

    public static Classification none() {
        return new Classification(Kind.NONE, null);
    }

    public static Classification check() {
        return new Classification(Kind.CHECK, null);
    }

    public static Classification checkmate() {
        return new Classification(Kind.CHECKMATE, null);
    }

    public static Classification stalemate() {
        return new Classification(Kind.STALEMATE, null);
    }

    public static Classification draw(String reason) {
        return new Classification(Kind.DRAW, reason);
    }

    public boolean isTerminal() {
        return kind == Kind.CHECKMATE || kind == Kind.STALEMATE || kind == Kind.DRAW;
    }

    public boolean inCheck() {
        return kind == Kind.CHECK || kind == Kind.CHECKMATE;
    }
}
