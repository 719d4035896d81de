package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 一步（伪）合法走法
 *
 * @param from      起点索引
 * @param to        终点索引
 * @param piece     走子（FEN 字符，区分大小写）
 * @param captured  被吃的子（小写/大写 FEN 字符），无则 0
 * @param promotion 升变目标（小写 'q','r','b','n'），无则 0
 * @param flags     特殊走法标记
 */
public record LegalMove(int from, int to, char piece, char captured, char promotion, int flags) {

    static final int DOUBLE_PUSH = 1;
    static final int EN_PASSANT = 2;
    static final int CASTLE_KING = 4;
    static final int CASTLE_QUEEN = 8;

    public String fromSquare() {
        return Squares.name(from);
    }

    public String toSquare() {
        return Squares.name(to);
    }

    public boolean isCapture() {
        return captured != 0;
    }

    boolean isDoublePush() {
        return (flags & DOUBLE_PUSH) != 0;
    }

    boolean isEnPassant() {
        return (flags & EN_PASSANT) != 0;
    }

    boolean isCastleKingside() {
        return (flags & CASTLE_KING) != 0;
    }

    boolean isCastleQueenside() {
        return (flags & CASTLE_QUEEN) != 0;
    }
}
