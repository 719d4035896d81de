package com.chesshub.chessservice.games.chess.domain.dto;

import lombok.Data;

/**
 * PlayerRecord
 * -------------------------------------------------------
 * 玩家档案与累计战绩（持久化）。
 * - 创建对局或加入对局时生成；只在对局结束时修改；从不删除；
 * - 积分规则：胜 +3，和 +1，负 +0。
 */
@Data
public class PlayerRecord {
    /** 玩家ID（UUID） */
    private String id;
    /** 展示名（已清洗） */
    private String displayName;
    private int wins;
    private int losses;
    private int draws;
    private int score;
    /** 创建时间（epoch millis） */
    private long createdAt;

    public int getGamesPlayed() {
        return wins + losses + draws;
    }
}
