package com.chesshub.chessservice.games.chess.domain.repository;

import com.chesshub.chessservice.games.chess.domain.dto.GameRecord;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * GameRecordRepository
 * ----------------------------------------
 * 对局记录仓储接口（Game-level Repository）
 * - 对局的权威持久化状态：双方、状态、结果、最新 FEN 与 PGN；
 * - 同时维护状态索引（统计用）与已完成对局的时间索引（最近对局）。
 * ----------------------------------------
 */
public interface GameRecordRepository {

    /** 新建等待中的对局（白方为房主） */
    void create(String gameId, String whitePlayerId, String initialFen);

    /** 黑方加入：写入 blackPlayerId，状态 WAITING → ACTIVE */
    void recordJoin(String gameId, String blackPlayerId);

    /** 每步落子后的局面快照 */
    void updatePosition(String gameId, String fen, String pgn);

    /** 终局：状态 COMPLETED 并写入结果 */
    void markCompleted(String gameId, GameResult result);

    Optional<GameRecord> findById(String gameId);

    /**
     * 最近完成的对局（按完成时间倒序）
     */
    List<GameRecord> recentCompleted(int limit);

    long countByStatus(SessionStatus status);
}
