package com.chesshub.chessservice.games.chess.application;

import com.chesshub.chessservice.games.chess.application.dto.ChessEvents;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.ErrorPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.GameOverPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.GameStatePayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.MoveMadePayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.MoveRejectedPayload;
import com.chesshub.chessservice.games.chess.application.dto.ChessEvents.PresencePayload;
import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;
import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.chessservice.games.chess.domain.enums.GameOverType;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import com.chesshub.chessservice.games.chess.domain.model.JoinResult;
import com.chesshub.chessservice.games.chess.service.impl.ChessSessionRegistryImpl;
import com.chesshub.chessservice.games.chess.support.TestSessions;
import com.chesshub.chessservice.platform.transport.RecordingBroadcaster;
import com.chesshub.chessservice.platform.transport.RecordingBroadcaster.Sent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChessSyncHandlerTest {

    private TestSessions env;
    private ChessSessionRegistryImpl registry;
    private RecordingBroadcaster out;
    private ChessSyncHandler handler;

    private String gameId;
    private String aliceId;
    private String bobId;

    @BeforeEach
    void setUp() {
        env = new TestSessions();
        registry = new ChessSessionRegistryImpl(env.rules, env.players, env.games, env.moves, env.timers, 60, 5);
        out = new RecordingBroadcaster();
        handler = new ChessSyncHandler(registry, env.players, out);

        JoinResult alice = registry.create("Alice");
        JoinResult bob = registry.join(alice.gameId(), "Bob");
        gameId = alice.gameId();
        aliceId = alice.playerId();
        bobId = bob.playerId();
    }

    private void bothJoined() {
        handler.onJoinGame("s-alice", gameId, aliceId);
        handler.onJoinGame("s-bob", gameId, bobId);
        out.clear();
    }

    @Test
    @DisplayName("完整对局：两步棋、越权走子被拒、认输、战绩与回收")
    void aliceAndBob() {
        handler.onJoinGame("s-alice", gameId, aliceId);
        assertThat(out.types()).containsExactly(ChessEvents.GAME_STATE);
        GameStatePayload aliceState = (GameStatePayload) out.toSocket("s-alice").get(0).payload();
        assertThat(aliceState.getYourColor()).isEqualTo(PlayerColor.WHITE);
        assertThat(aliceState.getWhiteName()).isEqualTo("Alice");
        assertThat(aliceState.getBlackName()).isEqualTo("Bob");

        handler.onJoinGame("s-bob", gameId, bobId);
        assertThat(out.toSocket("s-alice")).extracting(Sent::type)
                .containsExactly(ChessEvents.GAME_STATE, ChessEvents.PLAYER_CONNECTED);
        assertThat(out.toRoom(gameId)).extracting(Sent::type).containsExactly(ChessEvents.GAME_READY);
        assertThat(handler.boundSockets()).isEqualTo(2);
        out.clear();

        handler.onMakeMove("s-alice", "e2", "e4", null);
        handler.onMakeMove("s-bob", "e7", "e5", null);
        List<Sent> room = out.toRoom(gameId);
        assertThat(room).extracting(Sent::type).containsExactly(ChessEvents.MOVE_MADE, ChessEvents.MOVE_MADE);
        MoveMadePayload e5 = (MoveMadePayload) room.get(1).payload();
        assertThat(e5.getSan()).isEqualTo("e5");
        assertThat(e5.getMoveNumber()).isEqualTo(2);
        assertThat(e5.getTurn()).isEqualTo(PlayerColor.WHITE);
        out.clear();

        handler.onMakeMove("s-bob", "d7", "d5", null);
        assertThat(out.toRoom(gameId)).isEmpty();
        assertThat(out.toSocket("s-bob")).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo(ChessEvents.MOVE_REJECTED);
            assertThat(((MoveRejectedPayload) s.payload()).getError()).isEqualTo(GameMessages.NOT_YOUR_TURN);
        });
        assertThat(registry.find(gameId).orElseThrow().getMoveCount()).isEqualTo(2);
        out.clear();

        handler.onResign("s-bob");
        assertThat(out.toRoom(gameId)).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo(ChessEvents.GAME_OVER);
            GameOverPayload over = (GameOverPayload) s.payload();
            assertThat(over.getType()).isEqualTo(GameOverType.RESIGNATION);
            assertThat(over.getWinner()).isEqualTo(PlayerColor.WHITE);
            assertThat(over.getResult()).isEqualTo(GameResult.WHITE_WINS);
            assertThat(over.getWhiteScore()).isEqualTo(3);
            assertThat(over.getBlackScore()).isZero();
        });

        assertThat(env.games.findById(gameId)).get().satisfies(rec -> {
            assertThat(rec.getStatus()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(rec.getResult()).isEqualTo(GameResult.WHITE_WINS);
        });
        assertThat(env.players.findById(aliceId)).get()
                .extracting(PlayerRecord::getScore, PlayerRecord::getWins)
                .containsExactly(3, 1);
        assertThat(env.players.findById(bobId)).get()
                .extracting(PlayerRecord::getScore, PlayerRecord::getLosses)
                .containsExactly(0, 1);
        assertThat(env.timers.pending("evict:")).isEqualTo(1);
    }

    @Test
    @DisplayName("未绑定连接发来的事件被忽略")
    void unboundSocketIgnored() {
        handler.onMakeMove("ghost", "e2", "e4", null);
        handler.onResign("ghost");
        handler.onOfferDraw("ghost");
        handler.onDisconnect("ghost");

        assertThat(out.all()).isEmpty();
        assertThat(registry.find(gameId).orElseThrow().getMoveCount()).isZero();
    }

    @Test
    @DisplayName("join-game：对局不在内存或不是本局玩家时回 error-msg")
    void joinGameErrors() {
        handler.onJoinGame("s-x", "missing1", aliceId);
        handler.onJoinGame("s-y", gameId, "stranger");

        assertThat(out.toSocket("s-x")).singleElement().satisfies(s ->
                assertThat(((ErrorPayload) s.payload()).getMessage()).isEqualTo(GameMessages.GAME_NOT_FOUND));
        assertThat(out.toSocket("s-y")).singleElement().satisfies(s ->
                assertThat(((ErrorPayload) s.payload()).getMessage()).isEqualTo(GameMessages.NOT_A_PLAYER));
        assertThat(handler.boundSockets()).isZero();
    }

    @Test
    @DisplayName("提和、自己接受被拒、对方拒绝")
    void drawNegotiation() {
        bothJoined();

        handler.onOfferDraw("s-alice");
        assertThat(out.toSocket("s-bob")).singleElement()
                .extracting(Sent::type).isEqualTo(ChessEvents.DRAW_OFFERED);
        out.clear();

        handler.onAcceptDraw("s-alice");
        assertThat(out.toSocket("s-alice")).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo(ChessEvents.ERROR_MSG);
            assertThat(((ErrorPayload) s.payload()).getMessage()).isEqualTo(GameMessages.OWN_DRAW_OFFER);
        });
        out.clear();

        handler.onDeclineDraw("s-bob");
        assertThat(out.toSocket("s-alice")).singleElement()
                .extracting(Sent::type).isEqualTo(ChessEvents.DRAW_DECLINED);
        assertThat(registry.find(gameId).orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    @DisplayName("接受和棋后广播 game-over 并安排回收")
    void drawAccepted() {
        bothJoined();
        handler.onOfferDraw("s-bob");
        out.clear();

        handler.onAcceptDraw("s-alice");
        assertThat(out.toRoom(gameId)).singleElement().satisfies(s -> {
            GameOverPayload over = (GameOverPayload) s.payload();
            assertThat(over.getType()).isEqualTo(GameOverType.DRAW_AGREED);
            assertThat(over.getResult()).isEqualTo(GameResult.DRAW);
            assertThat(over.getWinner()).isNull();
        });
        assertThat(env.timers.pending("evict:")).isEqualTo(1);
    }

    @Test
    @DisplayName("掉线通知对手，宽限期满广播掉线判负")
    void disconnectAndAbandon() {
        bothJoined();

        handler.onDisconnect("s-bob");
        assertThat(out.toSocket("s-alice")).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo(ChessEvents.PLAYER_DISCONNECTED);
            PresencePayload p = (PresencePayload) s.payload();
            assertThat(p.getColor()).isEqualTo(PlayerColor.BLACK);
            assertThat(p.getName()).isEqualTo("Bob");
        });
        out.clear();

        env.timers.fire("grace:");
        assertThat(out.toRoom(gameId)).singleElement().satisfies(s -> {
            GameOverPayload over = (GameOverPayload) s.payload();
            assertThat(over.getType()).isEqualTo(GameOverType.ABANDONMENT);
            assertThat(over.getWinner()).isEqualTo(PlayerColor.WHITE);
            assertThat(over.getMessage()).isEqualTo("black player disconnected");
        });
        assertThat(handler.boundSockets()).isEqualTo(1);
    }

    @Test
    @DisplayName("宽限期内重新 join-game 取消判负，对手收到上线通知")
    void reconnectBeforeTimeout() {
        bothJoined();
        handler.onDisconnect("s-bob");
        out.clear();

        handler.onJoinGame("s-bob-2", gameId, bobId);
        assertThat(out.toSocket("s-alice")).extracting(Sent::type).containsExactly(ChessEvents.PLAYER_CONNECTED);
        assertThat(out.toRoom(gameId)).isEmpty();

        assertThat(env.timers.fire("grace:")).isZero();
        assertThat(registry.find(gameId).orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);

        handler.onMakeMove("s-alice", "e2", "e4", null);
        handler.onMakeMove("s-bob-2", "e7", "e5", null);
        assertThat(registry.find(gameId).orElseThrow().getMoveCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("持久化故障只回发送方通用错误，不广播")
    void storeFailureReportedToSenderOnly() {
        bothJoined();
        handler.onMakeMove("s-alice", "f2", "f3", null);
        handler.onMakeMove("s-bob", "e7", "e5", null);
        handler.onMakeMove("s-alice", "g2", "g4", null);
        out.clear();
        env.games.failNextCompletion();

        handler.onMakeMove("s-bob", "d8", "h4", null);

        assertThat(out.toRoom(gameId)).isEmpty();
        assertThat(out.toSocket("s-bob")).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo(ChessEvents.ERROR_MSG);
            assertThat(((ErrorPayload) s.payload()).getMessage()).isEqualTo(GameMessages.INTERNAL_ERROR);
        });
        assertThat(registry.find(gameId).orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }
}
