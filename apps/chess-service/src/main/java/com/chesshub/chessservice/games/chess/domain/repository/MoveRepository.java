package com.chesshub.chessservice.games.chess.domain.repository;

import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;

import java.util.List;

/**
 * 着法日志仓储接口：按 (对局, 步号) 存储，按步号顺序读取。
 * 同一步号重复写入覆盖旧记录，日志中每个步号至多一条。
 */
public interface MoveRepository {

    void append(MoveRecord move);

    /** 撤销某一步（该步后续写入失败时回滚用） */
    void remove(String gameId, int moveNumber);

    /** 按 moveNumber 升序 */
    List<MoveRecord> findByGameId(String gameId);
}
