package com.chesshub.chessservice.games.chess.domain.rule;

import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;

import java.util.ArrayList;
import java.util.List;

import static com.chesshub.chessservice.games.chess.domain.rule.ChessPosition.EMPTY;

/**
 * 走法生成与攻击检测（8x8 数组表示，按 (文件差, 行差) 偏移遍历）。
 * 纯函数，不持有状态。
 */
final class MoveGenerator {

    private static final int[][] KNIGHT = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] DIAGONAL = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final int[][] ORTHOGONAL = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final char[] PROMOTIONS = {'q', 'r', 'b', 'n'};

    private MoveGenerator() {}

    /** 行棋方全部合法走法（过滤掉走后己方王被攻击的伪合法走法） */
    static List<LegalMove> legalMoves(ChessPosition p) {
        boolean white = p.turn() == PlayerColor.WHITE;
        List<LegalMove> out = new ArrayList<>(48);
        for (LegalMove m : pseudoLegalMoves(p)) {
            ChessPosition after = p.copy();
            after.play(m);
            if (!isAttacked(after, kingSquare(after, white), !white)) {
                out.add(m);
            }
        }
        return out;
    }

    static boolean inCheck(ChessPosition p) {
        boolean white = p.turn() == PlayerColor.WHITE;
        int king = kingSquare(p, white);
        return king >= 0 && isAttacked(p, king, !white);
    }

    static int kingSquare(ChessPosition p, boolean white) {
        char king = white ? 'K' : 'k';
        for (int sq = 0; sq < 64; sq++) {
            if (p.pieceAt(sq) == king) return sq;
        }
        return -1;
    }

    private static List<LegalMove> pseudoLegalMoves(ChessPosition p) {
        boolean white = p.turn() == PlayerColor.WHITE;
        List<LegalMove> out = new ArrayList<>(64);
        for (int sq = 0; sq < 64; sq++) {
            char c = p.pieceAt(sq);
            if (c == EMPTY || Character.isUpperCase(c) != white) continue;
            switch (Character.toLowerCase(c)) {
                case 'p' -> pawnMoves(p, sq, c, white, out);
                case 'n' -> stepMoves(p, sq, c, white, KNIGHT, out);
                case 'b' -> slideMoves(p, sq, c, white, DIAGONAL, out);
                case 'r' -> slideMoves(p, sq, c, white, ORTHOGONAL, out);
                case 'q' -> {
                    slideMoves(p, sq, c, white, DIAGONAL, out);
                    slideMoves(p, sq, c, white, ORTHOGONAL, out);
                }
                case 'k' -> {
                    stepMoves(p, sq, c, white, KING, out);
                    castlingMoves(p, sq, c, white, out);
                }
                default -> { }
            }
        }
        return out;
    }

    private static void pawnMoves(ChessPosition p, int sq, char pawn, boolean white, List<LegalMove> out) {
        int dir = white ? 8 : -8;
        int startRank = white ? 1 : 6;
        int lastRank = white ? 7 : 0;
        int file = Squares.file(sq);

        int one = sq + dir;
        if (one >= 0 && one < 64 && p.pieceAt(one) == EMPTY) {
            addPawnMove(sq, one, pawn, (char) 0, 0, lastRank, out);
            int two = one + dir;
            if (Squares.rank(sq) == startRank && p.pieceAt(two) == EMPTY) {
                out.add(new LegalMove(sq, two, pawn, (char) 0, (char) 0, LegalMove.DOUBLE_PUSH));
            }
        }
        for (int df : new int[]{-1, 1}) {
            int f = file + df;
            if (f < 0 || f > 7) continue;
            int target = one + df;
            if (target < 0 || target >= 64) continue;
            char victim = p.pieceAt(target);
            if (victim != EMPTY && Character.isUpperCase(victim) != white) {
                addPawnMove(sq, target, pawn, victim, 0, lastRank, out);
            } else if (target == p.epSquare()) {
                out.add(new LegalMove(sq, target, pawn, white ? 'p' : 'P', (char) 0, LegalMove.EN_PASSANT));
            }
        }
    }

    private static void addPawnMove(int from, int to, char pawn, char captured, int flags,
                                    int lastRank, List<LegalMove> out) {
        if (Squares.rank(to) == lastRank) {
            for (char promo : PROMOTIONS) {
                out.add(new LegalMove(from, to, pawn, captured, promo, flags));
            }
        } else {
            out.add(new LegalMove(from, to, pawn, captured, (char) 0, flags));
        }
    }

    private static void stepMoves(ChessPosition p, int sq, char piece, boolean white,
                                  int[][] offsets, List<LegalMove> out) {
        int file = Squares.file(sq);
        int rank = Squares.rank(sq);
        for (int[] d : offsets) {
            int f = file + d[0];
            int r = rank + d[1];
            if (f < 0 || f > 7 || r < 0 || r > 7) continue;
            int target = r * 8 + f;
            char victim = p.pieceAt(target);
            if (victim == EMPTY) {
                out.add(new LegalMove(sq, target, piece, (char) 0, (char) 0, 0));
            } else if (Character.isUpperCase(victim) != white) {
                out.add(new LegalMove(sq, target, piece, victim, (char) 0, 0));
            }
        }
    }

    private static void slideMoves(ChessPosition p, int sq, char piece, boolean white,
                                   int[][] dirs, List<LegalMove> out) {
        for (int[] d : dirs) {
            int f = Squares.file(sq) + d[0];
            int r = Squares.rank(sq) + d[1];
            while (f >= 0 && f <= 7 && r >= 0 && r <= 7) {
                int target = r * 8 + f;
                char victim = p.pieceAt(target);
                if (victim == EMPTY) {
                    out.add(new LegalMove(sq, target, piece, (char) 0, (char) 0, 0));
                } else {
                    if (Character.isUpperCase(victim) != white) {
                        out.add(new LegalMove(sq, target, piece, victim, (char) 0, 0));
                    }
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
    }

    private static void castlingMoves(ChessPosition p, int sq, char king, boolean white, List<LegalMove> out) {
        int home = white ? 4 : 60;
        if (sq != home) return;
        int rights = p.castlingRights();
        int kingSide = white ? ChessPosition.CASTLE_WHITE_KING : ChessPosition.CASTLE_BLACK_KING;
        int queenSide = white ? ChessPosition.CASTLE_WHITE_QUEEN : ChessPosition.CASTLE_BLACK_QUEEN;
        char rook = white ? 'R' : 'r';
        boolean enemy = !white;

        if ((rights & kingSide) != 0
                && p.pieceAt(home + 3) == rook
                && p.pieceAt(home + 1) == EMPTY && p.pieceAt(home + 2) == EMPTY
                && !isAttacked(p, home, enemy) && !isAttacked(p, home + 1, enemy) && !isAttacked(p, home + 2, enemy)) {
            out.add(new LegalMove(home, home + 2, king, (char) 0, (char) 0, LegalMove.CASTLE_KING));
        }
        if ((rights & queenSide) != 0
                && p.pieceAt(home - 4) == rook
                && p.pieceAt(home - 1) == EMPTY && p.pieceAt(home - 2) == EMPTY && p.pieceAt(home - 3) == EMPTY
                && !isAttacked(p, home, enemy) && !isAttacked(p, home - 1, enemy) && !isAttacked(p, home - 2, enemy)) {
            out.add(new LegalMove(home, home - 2, king, (char) 0, (char) 0, LegalMove.CASTLE_QUEEN));
        }
    }

    /**
     * 格子 sq 是否被 byWhite 一方攻击。
     */
    static boolean isAttacked(ChessPosition p, int sq, boolean byWhite) {
        int file = Squares.file(sq);
        int rank = Squares.rank(sq);

        // 兵：白兵从下方斜向攻击，黑兵从上方
        int pawnRank = byWhite ? rank - 1 : rank + 1;
        char pawn = byWhite ? 'P' : 'p';
        if (pawnRank >= 0 && pawnRank <= 7) {
            if (file > 0 && p.pieceAt(pawnRank * 8 + file - 1) == pawn) return true;
            if (file < 7 && p.pieceAt(pawnRank * 8 + file + 1) == pawn) return true;
        }

        if (hitsByStep(p, file, rank, KNIGHT, byWhite ? 'N' : 'n')) return true;
        if (hitsByStep(p, file, rank, KING, byWhite ? 'K' : 'k')) return true;

        char queen = byWhite ? 'Q' : 'q';
        return hitsBySlide(p, file, rank, DIAGONAL, byWhite ? 'B' : 'b', queen)
                || hitsBySlide(p, file, rank, ORTHOGONAL, byWhite ? 'R' : 'r', queen);
    }

    private static boolean hitsByStep(ChessPosition p, int file, int rank, int[][] offsets, char attacker) {
        for (int[] d : offsets) {
            int f = file + d[0];
            int r = rank + d[1];
            if (f >= 0 && f <= 7 && r >= 0 && r <= 7 && p.pieceAt(r * 8 + f) == attacker) {
                return true;
            }
        }
        return false;
    }

    private static boolean hitsBySlide(ChessPosition p, int file, int rank, int[][] dirs, char slider, char queen) {
        for (int[] d : dirs) {
            int f = file + d[0];
            int r = rank + d[1];
            while (f >= 0 && f <= 7 && r >= 0 && r <= 7) {
                char c = p.pieceAt(r * 8 + f);
                if (c != EMPTY) {
                    if (c == slider || c == queen) return true;
                    break;
                }
                f += d[0];
                r += d[1];
            }
        }
        return false;
    }
}
