package com.chesshub.chessservice.games.chess.domain.rule;

/** 格子名与索引互转："a1" ↔ 0，"h8" ↔ 63 */
public final class Squares {

    private Squares() {}

    public static int index(String name) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("bad square: " + name);
        }
        return (name.charAt(1) - '1') * 8 + (name.charAt(0) - 'a');
    }

    public static String name(int index) {
        return "" + (char) ('a' + file(index)) + (char) ('1' + rank(index));
    }

    public static boolean isValid(String name) {
        return name != null && name.length() == 2
                && name.charAt(0) >= 'a' && name.charAt(0) <= 'h'
                && name.charAt(1) >= '1' && name.charAt(1) <= '8';
    }

    public static int file(int index) {
        return index & 7;
    }

    public static int rank(int index) {
        return index >> 3;
    }
}
