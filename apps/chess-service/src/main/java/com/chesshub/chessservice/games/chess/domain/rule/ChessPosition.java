package com.chesshub.chessservice.games.chess.domain.rule;

import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 可变棋局局面
 * ----------------------------------------
 * 足以判定下一步是否合法的全部信息：
 *   - 64 格棋子（大写白、小写黑、'.' 空）；索引 rank*8+file，a1=0，h8=63；
 *   - 行棋方、易位权、吃过路兵目标格、半回合计数、回合数；
 *   - 重复局面历史（用于三次重复判和）。
 * 局面归单个对局独占，只由 {@link RulesEngine} 修改。
 */
public final class ChessPosition {

    public static final char EMPTY = '.';
    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    static final int CASTLE_WHITE_KING = 1;
    static final int CASTLE_WHITE_QUEEN = 2;
    static final int CASTLE_BLACK_KING = 4;
    static final int CASTLE_BLACK_QUEEN = 8;

    private final char[] board = new char[64];
    private PlayerColor turn;
    private int castling;
    private int epSquare = -1;
    private int halfmoveClock;
    private int fullmoveNumber = 1;
    private final List<String> history = new ArrayList<>();

    private ChessPosition() {
        Arrays.fill(board, EMPTY);
    }

    public static ChessPosition initial() {
        return fromFen(START_FEN);
    }

    /**
     * 解析 FEN；格式不合法时抛 IllegalArgumentException。
     */
    public static ChessPosition fromFen(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("empty FEN");
        }
        String[] parts = fen.trim().split("\\s+");
        if (parts.length < 4) {
            throw new IllegalArgumentException("FEN needs at least 4 fields: " + fen);
        }
        ChessPosition p = new ChessPosition();

        String[] ranks = parts[0].split("/");
        if (ranks.length != 8) {
            throw new IllegalArgumentException("FEN needs 8 ranks: " + fen);
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char c : ranks[i].toCharArray()) {
                if (Character.isDigit(c)) {
                    file += c - '0';
                } else {
                    if ("pnbrqkPNBRQK".indexOf(c) < 0 || file > 7) {
                        throw new IllegalArgumentException("bad FEN placement: " + fen);
                    }
                    p.board[rank * 8 + file] = c;
                    file++;
                }
            }
            if (file != 8) {
                throw new IllegalArgumentException("bad FEN rank length: " + fen);
            }
        }

        if (parts[1].length() != 1) {
            throw new IllegalArgumentException("bad side to move: " + fen);
        }
        p.turn = PlayerColor.fromFenCode(parts[1].charAt(0));

        if (!"-".equals(parts[2])) {
            for (char c : parts[2].toCharArray()) {
                switch (c) {
                    case 'K' -> p.castling |= CASTLE_WHITE_KING;
                    case 'Q' -> p.castling |= CASTLE_WHITE_QUEEN;
                    case 'k' -> p.castling |= CASTLE_BLACK_KING;
                    case 'q' -> p.castling |= CASTLE_BLACK_QUEEN;
                    default -> throw new IllegalArgumentException("bad castling field: " + fen);
                }
            }
        }
        p.epSquare = "-".equals(parts[3]) ? -1 : Squares.index(parts[3]);
        p.halfmoveClock = parts.length > 4 ? Integer.parseInt(parts[4]) : 0;
        p.fullmoveNumber = parts.length > 5 ? Integer.parseInt(parts[5]) : 1;
        p.history.add(p.repetitionKey());
        return p;
    }

    public ChessPosition copy() {
        ChessPosition c = new ChessPosition();
        System.arraycopy(board, 0, c.board, 0, 64);
        c.turn = turn;
        c.castling = castling;
        c.epSquare = epSquare;
        c.halfmoveClock = halfmoveClock;
        c.fullmoveNumber = fullmoveNumber;
        c.history.addAll(history);
        return c;
    }

    public String toFen() {
        StringBuilder sb = new StringBuilder(90);
        appendPlacement(sb);
        sb.append(' ').append(turn.fenCode()).append(' ');
        appendCastling(sb);
        sb.append(' ').append(epSquare < 0 ? "-" : Squares.name(epSquare));
        sb.append(' ').append(halfmoveClock).append(' ').append(fullmoveNumber);
        return sb.toString();
    }

    /**
     * 重复局面判定用的键：棋子 + 行棋方 + 易位权 + 过路兵格。
     * 过路兵格只有在行棋方确实有兵能吃时才计入。
     */
    String repetitionKey() {
        StringBuilder sb = new StringBuilder(80);
        appendPlacement(sb);
        sb.append(' ').append(turn.fenCode()).append(' ');
        appendCastling(sb);
        sb.append(' ').append(epCapturable() ? Squares.name(epSquare) : "-");
        return sb.toString();
    }

    private boolean epCapturable() {
        if (epSquare < 0) return false;
        char pawn = turn == PlayerColor.WHITE ? 'P' : 'p';
        int fromRank = Squares.rank(epSquare) + (turn == PlayerColor.WHITE ? -1 : 1);
        if (fromRank < 0 || fromRank > 7) return false;
        int file = Squares.file(epSquare);
        return (file > 0 && board[fromRank * 8 + file - 1] == pawn)
                || (file < 7 && board[fromRank * 8 + file + 1] == pawn);
    }

    private void appendPlacement(StringBuilder sb) {
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                char c = board[rank * 8 + file];
                if (c == EMPTY) {
                    empty++;
                } else {
                    if (empty > 0) { sb.append(empty); empty = 0; }
                    sb.append(c);
                }
            }
            if (empty > 0) sb.append(empty);
            if (rank > 0) sb.append('/');
        }
    }

    private void appendCastling(StringBuilder sb) {
        if (castling == 0) {
            sb.append('-');
            return;
        }
        if ((castling & CASTLE_WHITE_KING) != 0) sb.append('K');
        if ((castling & CASTLE_WHITE_QUEEN) != 0) sb.append('Q');
        if ((castling & CASTLE_BLACK_KING) != 0) sb.append('k');
        if ((castling & CASTLE_BLACK_QUEEN) != 0) sb.append('q');
    }

    // ---- 局面推进（只由规则引擎调用，调用方保证走法已合法） ----

    void play(LegalMove m) {
        char piece = board[m.from()];
        boolean white = Character.isUpperCase(piece);
        char kind = Character.toLowerCase(piece);

        board[m.from()] = EMPTY;
        if (m.isEnPassant()) {
            board[m.to() + (white ? -8 : 8)] = EMPTY;
        }
        board[m.to()] = m.promotion() != 0
                ? (white ? Character.toUpperCase(m.promotion()) : m.promotion())
                : piece;

        if (m.isCastleKingside()) {
            int rookFrom = white ? 7 : 63;
            board[rookFrom - 2] = board[rookFrom];
            board[rookFrom] = EMPTY;
        } else if (m.isCastleQueenside()) {
            int rookFrom = white ? 0 : 56;
            board[rookFrom + 3] = board[rookFrom];
            board[rookFrom] = EMPTY;
        }

        // 王或车离开/被吃掉原位，取消对应易位权
        castling &= ~castleMaskTouching(m.from());
        castling &= ~castleMaskTouching(m.to());

        epSquare = m.isDoublePush() ? (m.from() + m.to()) / 2 : -1;
        halfmoveClock = (kind == 'p' || m.captured() != 0) ? 0 : halfmoveClock + 1;
        if (!white) fullmoveNumber++;
        turn = turn.opposite();
        history.add(repetitionKey());
    }

    private static int castleMaskTouching(int sq) {
        return switch (sq) {
            case 4 -> CASTLE_WHITE_KING | CASTLE_WHITE_QUEEN;
            case 7 -> CASTLE_WHITE_KING;
            case 0 -> CASTLE_WHITE_QUEEN;
            case 60 -> CASTLE_BLACK_KING | CASTLE_BLACK_QUEEN;
            case 63 -> CASTLE_BLACK_KING;
            case 56 -> CASTLE_BLACK_QUEEN;
            default -> 0;
        };
    }

    // ---- 只读访问 ----

    public char pieceAt(int sq) {
        return board[sq];
    }

    public char pieceAt(String square) {
        return board[Squares.index(square)];
    }

    public PlayerColor turn() {
        return turn;
    }

    int castlingRights() {
        return castling;
    }

    int epSquare() {
        return epSquare;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    List<String> history() {
        return Collections.unmodifiableList(history);
    }

    @Override
    public String toString() {
        return toFen();
    }
}
