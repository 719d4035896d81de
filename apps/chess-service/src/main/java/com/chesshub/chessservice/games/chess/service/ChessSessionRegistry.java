package com.chesshub.chessservice.games.chess.service;

import com.chesshub.chessservice.games.chess.domain.model.ChessSession;
import com.chesshub.chessservice.games.chess.domain.model.JoinResult;
import com.chesshub.chessservice.games.chess.domain.model.ReconnectResult;

import java.util.Optional;

/**
 * 在线对局注册表：进程内所有活跃对局的唯一入口。
 * 不在内存中的对局按需从持久化记录恢复（冷启动）。
 */
public interface ChessSessionRegistry {

    /** 新建对局，创建者执白，状态 waiting */
    JoinResult create(String creatorName);

    /**
     * 加入对局（执黑），状态 waiting → active。
     * 失败：GAME_NOT_FOUND / GAME_ALREADY_COMPLETED / GAME_ALREADY_STARTED / GAME_FULL
     */
    JoinResult join(String gameId, String joinerName);

    /**
     * 按玩家ID重连；已结束的对局只返回结果，不恢复到内存。
     * 失败：GAME_NOT_FOUND / NOT_A_PLAYER
     */
    ReconnectResult reconnect(String gameId, String playerId);

    /** 只查内存，不触发恢复 */
    Optional<ChessSession> find(String gameId);

    /** 移除已结束的对局；仍在 waiting/active 时拒绝并返回 false */
    boolean evict(String gameId);

    /** 终局后延迟回收 */
    void scheduleEviction(String gameId);
}
