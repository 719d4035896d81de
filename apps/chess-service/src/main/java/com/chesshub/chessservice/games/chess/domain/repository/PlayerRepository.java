package com.chesshub.chessservice.games.chess.domain.repository;

import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerOutcome;

import java.util.List;
import java.util.Optional;

/**
 * PlayerRepository
 * ----------------------------------------
 * 玩家档案与战绩仓储接口
 * - 创建玩家、按 ID 查询；
 * - 对局结束时按结果累加胜/负/和与积分；
 * - 排行榜（积分降序，积分相同按胜场降序）。
 * ----------------------------------------
 */
public interface PlayerRepository {

    /**
     * 创建玩家（战绩清零）
     * @param playerId    玩家ID
     * @param displayName 已清洗的展示名
     * @return 新建的玩家记录
     */
    PlayerRecord create(String playerId, String displayName);

    Optional<PlayerRecord> findById(String playerId);

    /**
     * 按单盘结果更新战绩：对应计数 +1，积分 + outcome.points()
     */
    void applyOutcome(String playerId, PlayerOutcome outcome);

    /**
     * 排行榜
     * @param limit 条数上限
     */
    List<PlayerRecord> leaderboard(int limit);

    long count();
}
