package com.chesshub.chessservice.games.chess.infrastructure.redis;

import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "chess:";

    private RedisKeys() {}

    // ---- 玩家 ----
    /** 玩家档案与战绩（Hash，字段均为字符串） */
    public static String player(String playerId) {
        return PFX + "player:" + playerId;
    }

    /** 玩家索引（SET），用于统计玩家总数 */
    public static String players() {
        return PFX + "players";
    }

    /** 排行榜（ZSET），score = 积分 * 1_000_000 + 胜场 */
    public static String leaderboard() {
        return PFX + "leaderboard";
    }

    // ---- 对局 ----
    public static String game(String gameId) {
        return PFX + "game:" + gameId;
    }

    /** 按状态的对局索引（SET） */
    public static String gamesByStatus(SessionStatus status) {
        return PFX + "games:status:" + status.wire();
    }

    /** 已完成对局（ZSET），score 为完成时间（epoch millis） */
    public static String completedGames() {
        return PFX + "games:completed";
    }

    // ---- 着法日志 ----
    /** 着法日志（HASH），field 为步号 */
    public static String moves(String gameId) {
        return PFX + "game:" + gameId + ":moves";
    }
}
