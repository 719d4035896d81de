package com.chesshub.chessservice.games.chess.application;

import com.chesshub.chessservice.games.chess.application.dto.ChessEvents;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.DrawOfferedPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.ErrorPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.GameOverPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.GameReadyPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.GameStatePayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.MoveMadePayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.MoveRejectedPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.PresencePayload;
import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;
import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.exception.ChessGameException;
import com.chesshub.chessservice.games.chess.domain.model.ChessSession;
import com.chesshub.chessservice.games.chess.domain.model.DrawResponse;
import com.chesshub.chessservice.games.chess.domain.model.GameOver;
import com.chesshub.chessservice.games.chess.domain.model.MoveOutcome;
import com.chesshub.chessservice.games.chess.domain.repository.PlayerRepository;
import com.chesshub.chessservice.games.chess.service.ChessSessionRegistry;
import com.chesshub.chessservice.platform.transport.RoomBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 实时同步协议处理器（与传输层无关）
 * ----------------------------------------
 * 入站事件：join-game / make-move / resign / offer-draw / accept-draw / decline-draw / disconnect。
 * 连接只有在 join-game 成功后才与 (对局, 玩家) 绑定；未绑定连接发来的其他事件一律忽略。
 *
 * 每个事件的“状态修改 + 广播”都在对应对局的锁内完成，广播顺序即提交顺序。
 * 调用方错误回给发送方（move-rejected / error-msg）；持久化或规则引擎故障记错误日志，
 * 只给发送方一个通用 error-msg，不做房间广播。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChessSyncHandler {

    private final ChessSessionRegistry registry;
    private final PlayerRepository players;
    private final RoomBroadcaster broadcaster;

    /** 连接ID -> 绑定的对局与玩家 */
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    record Binding(String gameId, String playerId) {}

    // ==========================================================
    // join-game
    // ==========================================================

    public void onJoinGame(String socketId, String gameId, String playerId) {
        Optional<ChessSession> found = registry.find(gameId);
        if (found.isEmpty()) {
            sendError(socketId, gameId, GameMessages.GAME_NOT_FOUND);
            return;
        }
        ChessSession session = found.get();
        try {
            session.withLock(() -> bind(session, socketId, gameId, playerId));
        } catch (RuntimeException e) {
            log.error("join-game failed: game={}, player={}, socket={}", gameId, playerId, socketId, e);
            sendError(socketId, gameId, GameMessages.INTERNAL_ERROR);
        }
    }

    private void bind(ChessSession session, String socketId, String gameId, String playerId) {
        PlayerColor color = session.colorOf(playerId);
        if (color == null) {
            log.warn("join-game rejected, not a player: game={}, player={}, socket={}", gameId, playerId, socketId);
            sendError(socketId, gameId, GameMessages.NOT_A_PLAYER);
            return;
        }
        session.attach(playerId, socketId);
        bindings.put(socketId, new Binding(gameId, playerId));

        String whiteName = nameOf(session.getWhitePlayerId());
        String blackName = nameOf(session.getBlackPlayerId());
        broadcaster.toSocket(socketId, gameId, ChessEvents.GAME_STATE,
                new GameStatePayload(session.getState(), color, whiteName, blackName));

        String selfName = color == PlayerColor.WHITE ? whiteName : blackName;
        toOpponent(session, color, ChessEvents.PLAYER_CONNECTED, new PresencePayload(color, selfName));

        if (session.markReadyBroadcast()) {
            broadcaster.toRoom(gameId, ChessEvents.GAME_READY, new GameReadyPayload(whiteName, blackName));
        }
        log.info("socket bound: game={}, player={}, color={}, socket={}", gameId, playerId, color.wire(), socketId);
    }

    // ==========================================================
    // make-move
    // ==========================================================

    public void onMakeMove(String socketId, String from, String to, String promotion) {
        withBoundSession(socketId, (b, session) -> {
            try {
                MoveOutcome out = session.applyMove(b.playerId(), from, to, promotion);
                broadcaster.toRoom(b.gameId(), ChessEvents.MOVE_MADE, MoveMadePayload.builder()
                        .from(from)
                        .to(to)
                        .promotion(promotion)
                        .san(out.move().san())
                        .fen(out.fen())
                        .turn(out.turn())
                        .inCheck(out.inCheck())
                        .moveNumber(out.moveNumber())
                        .captured(out.move().captured())
                        .piece(out.move().piece())
                        .legalMoves(out.legalMoves())
                        .build());
                out.gameOverOpt().ifPresent(over -> announceGameOver(session, over));
            } catch (ChessGameException e) {
                log.warn("move rejected: game={}, player={}, {}->{}, reason={}",
                        b.gameId(), b.playerId(), from, to, e.getKind());
                broadcaster.toSocket(socketId, b.gameId(), ChessEvents.MOVE_REJECTED,
                        new MoveRejectedPayload(e.getMessage()));
            }
        });
    }

    // ==========================================================
    // resign / draw
    // ==========================================================

    public void onResign(String socketId) {
        withBoundSession(socketId, (b, session) ->
                session.resign(b.playerId()).ifPresent(over -> announceGameOver(session, over)));
    }

    public void onOfferDraw(String socketId) {
        withBoundSession(socketId, (b, session) -> {
            DrawResponse r = session.offerDraw(b.playerId());
            if (!r.accepted()) {
                sendError(socketId, b.gameId(), r.rejectReason());
                return;
            }
            toOpponent(session, r.offeredBy(), ChessEvents.DRAW_OFFERED, new DrawOfferedPayload(r.offeredBy()));
        });
    }

    public void onAcceptDraw(String socketId) {
        withBoundSession(socketId, (b, session) -> {
            DrawResponse r = session.acceptDraw(b.playerId());
            if (!r.accepted()) {
                sendError(socketId, b.gameId(), r.rejectReason());
                return;
            }
            announceGameOver(session, r.gameOver());
        });
    }

    public void onDeclineDraw(String socketId) {
        withBoundSession(socketId, (b, session) -> {
            DrawResponse r = session.declineDraw(b.playerId());
            if (!r.accepted()) {
                sendError(socketId, b.gameId(), r.rejectReason());
                return;
            }
            PlayerColor self = session.colorOf(b.playerId());
            toOpponent(session, self, ChessEvents.DRAW_DECLINED, Map.of());
        });
    }

    // ==========================================================
    // disconnect
    // ==========================================================

    public void onDisconnect(String socketId) {
        Binding b = bindings.remove(socketId);
        if (b == null) {
            return;
        }
        Optional<ChessSession> found = registry.find(b.gameId());
        if (found.isEmpty()) {
            return;
        }
        ChessSession session = found.get();
        session.withLock(() -> session
                .detach(b.playerId(), socketId, over -> announceGameOver(session, over))
                .ifPresent(color -> toOpponent(session, color, ChessEvents.PLAYER_DISCONNECTED,
                        new PresencePayload(color, nameOf(session.playerIdOf(color))))));
    }

    /** 当前绑定数（监控/测试用） */
    public int boundSockets() {
        return bindings.size();
    }

    // ==========================================================
    // helpers
    // ==========================================================

    /**
     * 终局广播 + 安排回收。调用方已持有对局锁。
     */
    private void announceGameOver(ChessSession session, GameOver over) {
        Optional<PlayerRecord> white = players.findById(session.getWhitePlayerId());
        Optional<PlayerRecord> black = players.findById(session.getBlackPlayerId());
        broadcaster.toRoom(session.getId(), ChessEvents.GAME_OVER, GameOverPayload.builder()
                .type(over.type())
                .winner(over.winner())
                .result(over.result())
                .reason(over.reason())
                .message(over.message())
                .whiteName(white.map(PlayerRecord::getDisplayName).orElse(null))
                .blackName(black.map(PlayerRecord::getDisplayName).orElse(null))
                .whiteScore(white.map(PlayerRecord::getScore).orElse(null))
                .blackScore(black.map(PlayerRecord::getScore).orElse(null))
                .build());
        registry.scheduleEviction(session.getId());
    }

    /**
     * 查找连接绑定的对局并在锁内执行；未绑定或对局已回收时忽略。
     * 非业务异常（持久化/规则引擎）在这里兜住：记日志，只回发送方。
     */
    private void withBoundSession(String socketId, BoundAction action) {
        Binding b = bindings.get(socketId);
        if (b == null) {
            log.debug("event from unbound socket ignored: socket={}", socketId);
            return;
        }
        Optional<ChessSession> found = registry.find(b.gameId());
        if (found.isEmpty()) {
            log.debug("event for evicted game ignored: game={}, socket={}", b.gameId(), socketId);
            return;
        }
        ChessSession session = found.get();
        session.withLock(() -> {
            try {
                action.run(b, session);
            } catch (ChessGameException e) {
                log.warn("event rejected: game={}, player={}, reason={}", b.gameId(), b.playerId(), e.getKind());
                sendError(socketId, b.gameId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("event failed: game={}, player={}, socket={}", b.gameId(), b.playerId(), socketId, e);
                sendError(socketId, b.gameId(), GameMessages.INTERNAL_ERROR);
            }
        });
    }

    @FunctionalInterface
    private interface BoundAction {
        void run(Binding binding, ChessSession session);
    }

    private void toOpponent(ChessSession session, PlayerColor self, String type, Object payload) {
        String socket = session.socketOf(self.opposite());
        if (socket != null) {
            broadcaster.toSocket(socket, session.getId(), type, payload);
        }
    }

    private void sendError(String socketId, String gameId, String message) {
        broadcaster.toSocket(socketId, gameId, ChessEvents.ERROR_MSG, new ErrorPayload(message));
    }

    private String nameOf(String playerId) {
        return players.findById(playerId)
                .map(PlayerRecord::getDisplayName)
                .orElse(GameMessages.WAITING_NAME);
    }
}
