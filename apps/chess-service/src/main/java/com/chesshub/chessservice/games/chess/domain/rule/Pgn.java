package com.chesshub.chessservice.games.chess.domain.rule;

import java.util.List;

/** SAN 着法列表 → PGN 着法文本，如 "1. e4 e5 2. Nf3" */
public final class Pgn {

    private Pgn() {}

    public static String movetext(List<String> sanMoves) {
        StringBuilder sb = new StringBuilder(sanMoves.size() * 6);
        for (int i = 0; i < sanMoves.size(); i++) {
            if (i > 0) sb.append(' ');
            if (i % 2 == 0) sb.append(i / 2 + 1).append(". ");
            sb.append(sanMoves.get(i));
        }
        return sb.toString();
    }
}
