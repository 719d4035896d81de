package com.chesshub.chessservice.games.chess.infrastructure.redis.repo;

import com.chesshub.chessservice.games.chess.domain.dto.GameRecord;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import com.chesshub.chessservice.games.chess.domain.repository.GameRecordRepository;
import com.chesshub.chessservice.games.chess.infrastructure.redis.RedisKeys;
import com.chesshub.chessservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * RedisGameRecordRepository
 * -------------------------------------------------------
 * 对局记录的 Redis 仓储实现。
 * - 记录本体：JSON（GameRecord）；
 * - 状态索引：chess:games:status:{status}，状态迁移时 SMOVE；
 * - 完成索引：chess:games:completed（ZSET，按完成时间）。
 * 对局记录不设 TTL，历史对局长期保留。
 */
@Repository
@RequiredArgsConstructor
public class RedisGameRecordRepository implements GameRecordRepository {

    private final RedisOps ops;

    @Override
    public void create(String gameId, String whitePlayerId, String initialFen) {
        long now = System.currentTimeMillis();
        GameRecord rec = new GameRecord();
        rec.setId(gameId);
        rec.setWhitePlayerId(whitePlayerId);
        rec.setStatus(SessionStatus.WAITING);
        rec.setFen(initialFen);
        rec.setPgn("");
        rec.setCreatedAt(now);
        rec.setUpdatedAt(now);
        ops.set(RedisKeys.game(gameId), rec);
        ops.sAdd(RedisKeys.gamesByStatus(SessionStatus.WAITING), gameId);
    }

    @Override
    public void recordJoin(String gameId, String blackPlayerId) {
        GameRecord rec = require(gameId);
        rec.setBlackPlayerId(blackPlayerId);
        rec.setStatus(SessionStatus.ACTIVE);
        rec.setUpdatedAt(System.currentTimeMillis());
        ops.set(RedisKeys.game(gameId), rec);
        ops.sMove(RedisKeys.gamesByStatus(SessionStatus.WAITING), gameId, RedisKeys.gamesByStatus(SessionStatus.ACTIVE));
    }

    @Override
    public void updatePosition(String gameId, String fen, String pgn) {
        GameRecord rec = require(gameId);
        rec.setFen(fen);
        rec.setPgn(pgn);
        rec.setUpdatedAt(System.currentTimeMillis());
        ops.set(RedisKeys.game(gameId), rec);
    }

    @Override
    public void markCompleted(String gameId, GameResult result) {
        GameRecord rec = require(gameId);
        SessionStatus before = rec.getStatus();
        long now = System.currentTimeMillis();
        rec.setStatus(SessionStatus.COMPLETED);
        rec.setResult(result);
        rec.setUpdatedAt(now);
        ops.set(RedisKeys.game(gameId), rec);
        if (before != null) {
            ops.sMove(RedisKeys.gamesByStatus(before), gameId, RedisKeys.gamesByStatus(SessionStatus.COMPLETED));
        } else {
            ops.sAdd(RedisKeys.gamesByStatus(SessionStatus.COMPLETED), gameId);
        }
        ops.zAdd(RedisKeys.completedGames(), gameId, now);
    }

    @Override
    public Optional<GameRecord> findById(String gameId) {
        return Optional.ofNullable(ops.get(RedisKeys.game(gameId), GameRecord.class));
    }

    @Override
    public List<GameRecord> recentCompleted(int limit) {
        List<GameRecord> out = new ArrayList<>();
        for (String id : ops.zRevRange(RedisKeys.completedGames(), limit)) {
            findById(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public long countByStatus(SessionStatus status) {
        return ops.sCard(RedisKeys.gamesByStatus(status));
    }

    private GameRecord require(String gameId) {
        return findById(gameId)
                .orElseThrow(() -> new IllegalStateException("game record missing: " + gameId));
    }
}
