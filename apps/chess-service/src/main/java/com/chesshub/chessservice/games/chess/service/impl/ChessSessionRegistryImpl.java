package com.chesshub.chessservice.games.chess.service.impl;

import com.chesshub.chessservice.clock.scheduler.GraceTimerScheduler;
import com.chesshub.chessservice.games.chess.domain.dto.GameRecord;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.exception.ChessGameException;
import com.chesshub.chessservice.games.chess.domain.exception.ErrorKind;
import com.chesshub.chessservice.games.chess.domain.model.ChessSession;
import com.chesshub.chessservice.games.chess.domain.model.ChessSessionContext;
import com.chesshub.chessservice.games.chess.domain.model.JoinResult;
import com.chesshub.chessservice.games.chess.domain.model.ReconnectResult;
import com.chesshub.chessservice.games.chess.domain.repository.GameRecordRepository;
import com.chesshub.chessservice.games.chess.domain.repository.MoveRepository;
import com.chesshub.chessservice.games.chess.domain.repository.PlayerRepository;
import com.chesshub.chessservice.games.chess.domain.rule.RulesEngine;
import com.chesshub.chessservice.games.chess.service.ChessSessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class ChessSessionRegistryImpl implements ChessSessionRegistry {

    /** 对局ID：6 字节随机数 → 8 位 Base64URL */
    private static final int GAME_ID_BYTES = 6;

    // ====== 内存对局表 ======
    private final Map<String, ChessSession> sessions = new ConcurrentHashMap<>();

    private final SecureRandom idRnd = new SecureRandom();

    private final PlayerRepository players;
    private final GameRecordRepository games;
    private final MoveRepository moves;
    private final GraceTimerScheduler timers;
    private final ChessSessionContext ctx;
    private final Duration evictionDelay;

    public ChessSessionRegistryImpl(RulesEngine rules,
                                    PlayerRepository players,
                                    GameRecordRepository games,
                                    MoveRepository moves,
                                    GraceTimerScheduler timers,
                                    @Value("${chess.disconnect.grace-seconds:60}") long graceSeconds,
                                    @Value("${chess.session.eviction-minutes:5}") long evictionMinutes) {
        this.players = players;
        this.games = games;
        this.moves = moves;
        this.timers = timers;
        this.ctx = new ChessSessionContext(rules, players, games, moves, timers, Duration.ofSeconds(graceSeconds));
        this.evictionDelay = Duration.ofMinutes(evictionMinutes);
    }

    /**
     * 创建新对局
     */
    @Override
    public JoinResult create(String creatorName) {
        String playerId = UUID.randomUUID().toString();
        String gameId = newGameId();

        players.create(playerId, creatorName);
        ChessSession session = ChessSession.create(ctx, gameId, playerId);
        games.create(gameId, playerId, session.getFen());
        sessions.put(gameId, session);

        log.info("game created: game={}, white={}", gameId, playerId);
        return new JoinResult(gameId, playerId, PlayerColor.WHITE);
    }

    @Override
    public JoinResult join(String gameId, String joinerName) {
        ChessSession session = sessions.get(gameId);
        if (session == null) {
            // 冷启动：先按持久化记录做前置判断，再恢复到内存
            GameRecord rec = games.findById(gameId)
                    .orElseThrow(() -> new ChessGameException(ErrorKind.GAME_NOT_FOUND));
            if (rec.getStatus() != null && rec.getStatus().isTerminal()) {
                throw new ChessGameException(ErrorKind.GAME_ALREADY_COMPLETED);
            }
            if (rec.getBlackPlayerId() != null) {
                throw new ChessGameException(ErrorKind.GAME_FULL);
            }
            session = hydrate(rec);
        }
        String playerId = session.join(joinerName);
        return new JoinResult(gameId, playerId, PlayerColor.BLACK);
    }

    @Override
    public ReconnectResult reconnect(String gameId, String playerId) {
        ChessSession session = sessions.get(gameId);
        if (session == null) {
            GameRecord rec = games.findById(gameId)
                    .orElseThrow(() -> new ChessGameException(ErrorKind.GAME_NOT_FOUND));
            if (rec.getStatus() != null && rec.getStatus().isTerminal()) {
                PlayerColor color = colorInRecord(rec, playerId);
                if (color == null) {
                    throw new ChessGameException(ErrorKind.NOT_A_PLAYER);
                }
                return ReconnectResult.finished(gameId, playerId, color, rec.getResult(), rec.getFen());
            }
            session = hydrate(rec);
        }
        PlayerColor color = session.colorOf(playerId);
        if (color == null) {
            throw new ChessGameException(ErrorKind.NOT_A_PLAYER);
        }
        log.info("player reconnected: game={}, player={}, color={}", gameId, playerId, color.wire());
        return ReconnectResult.live(gameId, playerId, color);
    }

    @Override
    public Optional<ChessSession> find(String gameId) {
        return gameId == null ? Optional.empty() : Optional.ofNullable(sessions.get(gameId));
    }

    @Override
    public boolean evict(String gameId) {
        ChessSession session = sessions.get(gameId);
        if (session == null) {
            return false;
        }
        if (!session.getStatus().isTerminal()) {
            log.warn("evict refused, game still live: game={}, status={}", gameId, session.getStatus().wire());
            return false;
        }
        boolean removed = sessions.remove(gameId, session);
        if (removed) {
            log.info("game evicted: game={}", gameId);
        }
        return removed;
    }

    @Override
    public void scheduleEviction(String gameId) {
        timers.schedule("evict:" + gameId, evictionDelay, () -> evict(gameId));
    }

    /**
     * 从持久化记录恢复对局；并发恢复时以先放入的实例为准。
     */
    private ChessSession hydrate(GameRecord rec) {
        ChessSession restored = ChessSession.restore(ctx, rec, moves.findByGameId(rec.getId()));
        ChessSession existing = sessions.putIfAbsent(rec.getId(), restored);
        if (existing != null) {
            return existing;
        }
        log.info("game restored from store: game={}, status={}, moves={}",
                rec.getId(), restored.getStatus().wire(), restored.getMoveCount());
        return restored;
    }

    private static PlayerColor colorInRecord(GameRecord rec, String playerId) {
        if (playerId == null) return null;
        if (playerId.equals(rec.getWhitePlayerId())) return PlayerColor.WHITE;
        if (playerId.equals(rec.getBlackPlayerId())) return PlayerColor.BLACK;
        return null;
    }

    private String newGameId() {
        byte[] buf = new byte[GAME_ID_BYTES];
        String id;
        do {
            idRnd.nextBytes(buf);
            id = Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
        } while (sessions.containsKey(id) || games.findById(id).isPresent());
        return id;
    }
}
