package com.chesshub.chessservice.games.chess.infrastructure.redis.repo;

import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;
import com.chesshub.chessservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisMoveRepositoryTest {

    @Mock
    private RedisOps ops;

    @InjectMocks
    private RedisMoveRepository repo;

    @Test
    @DisplayName("着法按步号写入 Hash 字段，重写同一步只覆盖该字段")
    void appendIsKeyedByMoveNumber() {
        MoveRecord first = move(4, "Qh4");
        MoveRecord retry = move(4, "Qh4#");

        repo.append(first);
        repo.append(retry);

        verify(ops).hSet("chess:game:g1:moves", "4", first);
        verify(ops).hSet("chess:game:g1:moves", "4", retry);
    }

    @Test
    @DisplayName("回滚删除对应步号字段")
    void removeDeletesField() {
        repo.remove("g1", 7);

        verify(ops).hDel("chess:game:g1:moves", "7");
    }

    @Test
    @DisplayName("读取时按步号升序")
    void findSortsByMoveNumber() {
        when(ops.hValues("chess:game:g1:moves", MoveRecord.class))
                .thenReturn(List.of(move(10, "Nf3"), move(2, "e5"), move(1, "e4")));

        assertThat(repo.findByGameId("g1"))
                .extracting(MoveRecord::getMoveNumber)
                .containsExactly(1, 2, 10);
    }

    private static MoveRecord move(int number, String san) {
        MoveRecord m = new MoveRecord();
        m.setGameId("g1");
        m.setMoveNumber(number);
        m.setSan(san);
        return m;
    }
}
