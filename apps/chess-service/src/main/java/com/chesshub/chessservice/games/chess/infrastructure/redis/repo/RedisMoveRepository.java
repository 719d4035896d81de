package com.chesshub.chessservice.games.chess.infrastructure.redis.repo;

import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;
import com.chesshub.chessservice.games.chess.domain.repository.MoveRepository;
import com.chesshub.chessservice.games.chess.infrastructure.redis.RedisKeys;
import com.chesshub.chessservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 着法日志的 Redis 仓储实现（HASH，field = 步号，value = JSON 着法）。
 * 重试同一步只会覆盖该字段，不会产生重复步号。
 */
@Repository
@RequiredArgsConstructor
public class RedisMoveRepository implements MoveRepository {

    private final RedisOps ops;

    @Override
    public void append(MoveRecord move) {
        ops.hSet(RedisKeys.moves(move.getGameId()), String.valueOf(move.getMoveNumber()), move);
    }

    @Override
    public void remove(String gameId, int moveNumber) {
        ops.hDel(RedisKeys.moves(gameId), String.valueOf(moveNumber));
    }

    @Override
    public List<MoveRecord> findByGameId(String gameId) {
        List<MoveRecord> list = new ArrayList<>(ops.hValues(RedisKeys.moves(gameId), MoveRecord.class));
        list.sort(Comparator.comparingInt(MoveRecord::getMoveNumber));
        return list;
    }
}
