package com.chesshub.chessservice.games.chess.domain.enums;

/**
 * 单个玩家在一盘棋中的结果，以及对应的积分增量：
 * 胜 +3，和 +1，负 +0。
 */
public enum PlayerOutcome {
    WIN("wins", 3),
    LOSS("losses", 0),
    DRAW("draws", 1);

    /** 玩家统计中对应的计数字段 */
    private final String counterField;
    private final int points;

    PlayerOutcome(String counterField, int points) {
        this.counterField = counterField;
        this.points = points;
    }

    public String counterField() {
        return counterField;
    }

    public int points() {
        return points;
    }
}
