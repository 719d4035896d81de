package com.chesshub.chessservice.games.chess.infrastructure.redis.repo;

import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerOutcome;
import com.chesshub.chessservice.games.chess.domain.repository.PlayerRepository;
import com.chesshub.chessservice.games.chess.infrastructure.redis.RedisKeys;
import com.chesshub.chessservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RedisPlayerRepository
 * -------------------------------------------------------
 * 玩家档案的 Redis 仓储实现。
 * - 档案存为字符串 Hash，战绩用 HINCRBY 原子累加；
 * - 排行榜 ZSET 的分数把“积分、胜场”压成一个数，保证 积分降序 → 胜场降序 的排序。
 */
@Repository
@RequiredArgsConstructor
public class RedisPlayerRepository implements PlayerRepository {

    /** 复合排序分数中积分的权重（胜场不会超过该值） */
    private static final double SCORE_WEIGHT = 1_000_000d;

    private static final String F_ID = "id";
    private static final String F_NAME = "displayName";
    private static final String F_SCORE = "score";
    private static final String F_CREATED = "createdAt";

    private final RedisOps ops;

    @Override
    public PlayerRecord create(String playerId, String displayName) {
        long now = System.currentTimeMillis();
        Map<String, String> fields = new HashMap<>();
        fields.put(F_ID, playerId);
        fields.put(F_NAME, displayName);
        fields.put(PlayerOutcome.WIN.counterField(), "0");
        fields.put(PlayerOutcome.LOSS.counterField(), "0");
        fields.put(PlayerOutcome.DRAW.counterField(), "0");
        fields.put(F_SCORE, "0");
        fields.put(F_CREATED, String.valueOf(now));
        ops.hSetAll(RedisKeys.player(playerId), fields);
        ops.sAdd(RedisKeys.players(), playerId);
        ops.zAdd(RedisKeys.leaderboard(), playerId, 0d);

        PlayerRecord rec = new PlayerRecord();
        rec.setId(playerId);
        rec.setDisplayName(displayName);
        rec.setCreatedAt(now);
        return rec;
    }

    @Override
    public Optional<PlayerRecord> findById(String playerId) {
        if (playerId == null) return Optional.empty();
        Map<String, String> h = ops.hGetAll(RedisKeys.player(playerId));
        if (h.isEmpty()) return Optional.empty();
        return Optional.of(toRecord(h));
    }

    @Override
    public void applyOutcome(String playerId, PlayerOutcome outcome) {
        String key = RedisKeys.player(playerId);
        Long wins;
        if (outcome == PlayerOutcome.WIN) {
            wins = ops.hIncrBy(key, PlayerOutcome.WIN.counterField(), 1);
        } else {
            ops.hIncrBy(key, outcome.counterField(), 1);
            wins = ops.hIncrBy(key, PlayerOutcome.WIN.counterField(), 0);
        }
        Long score = ops.hIncrBy(key, F_SCORE, outcome.points());
        double rank = (score == null ? 0 : score) * SCORE_WEIGHT + (wins == null ? 0 : wins);
        ops.zAdd(RedisKeys.leaderboard(), playerId, rank);
    }

    @Override
    public List<PlayerRecord> leaderboard(int limit) {
        List<PlayerRecord> out = new ArrayList<>();
        for (String id : ops.zRevRange(RedisKeys.leaderboard(), limit)) {
            findById(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public long count() {
        return ops.sCard(RedisKeys.players());
    }

    private static PlayerRecord toRecord(Map<String, String> h) {
        PlayerRecord r = new PlayerRecord();
        r.setId(h.get(F_ID));
        r.setDisplayName(h.get(F_NAME));
        r.setWins(NumberUtils.toInt(h.get(PlayerOutcome.WIN.counterField())));
        r.setLosses(NumberUtils.toInt(h.get(PlayerOutcome.LOSS.counterField())));
        r.setDraws(NumberUtils.toInt(h.get(PlayerOutcome.DRAW.counterField())));
        r.setScore(NumberUtils.toInt(h.get(F_SCORE)));
        r.setCreatedAt(NumberUtils.toLong(h.get(F_CREATED)));
        return r;
    }
}
