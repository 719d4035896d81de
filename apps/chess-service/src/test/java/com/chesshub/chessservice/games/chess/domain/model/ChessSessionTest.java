package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.clock.scheduler.GraceTimerScheduler;
import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;
import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;
import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.chessservice.games.chess.domain.enums.GameOverType;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import com.chesshub.chessservice.games.chess.domain.exception.ChessGameException;
import com.chesshub.chessservice.games.chess.domain.exception.ErrorKind;
import com.chesshub.chessservice.games.chess.domain.rule.ChessPosition;
import com.chesshub.chessservice.games.chess.support.TestSessions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChessSessionTest {

    private static final String GAME_ID = "g1";
    private static final String WHITE_ID = "white-1";

    private TestSessions env;
    private ChessSession session;
    private String blackId;

    @BeforeEach
    void setUp() {
        env = new TestSessions();
        env.players.create(WHITE_ID, "Alice");
        session = ChessSession.create(env.context(), GAME_ID, WHITE_ID);
        env.games.create(GAME_ID, WHITE_ID, session.getFen());
        blackId = session.join("Bob");
    }

    @Test
    @DisplayName("等待中的对局只能加入一次")
    void joinOnlyOnce() {
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.colorOf(blackId)).isEqualTo(PlayerColor.BLACK);
        assertThat(env.games.findById(GAME_ID)).get()
                .satisfies(rec -> assertThat(rec.getBlackPlayerId()).isEqualTo(blackId));

        assertThatThrownBy(() -> session.join("Carol"))
                .isInstanceOf(ChessGameException.class)
                .extracting(e -> ((ChessGameException) e).getKind())
                .isEqualTo(ErrorKind.GAME_ALREADY_STARTED);
        assertThat(env.players.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("不是自己的回合走子被拒绝，局面与步数不变")
    void outOfTurnMoveDoesNotMutate() {
        String before = session.getFen();

        assertThatThrownBy(() -> session.applyMove(blackId, "e7", "e5", null))
                .isInstanceOf(ChessGameException.class)
                .extracting(e -> ((ChessGameException) e).getKind())
                .isEqualTo(ErrorKind.NOT_YOUR_TURN);
        assertThatThrownBy(() -> session.applyMove("stranger", "e2", "e4", null))
                .isInstanceOf(ChessGameException.class)
                .extracting(e -> ((ChessGameException) e).getKind())
                .isEqualTo(ErrorKind.NOT_YOUR_TURN);

        assertThat(session.getFen()).isEqualTo(before);
        assertThat(session.getMoveCount()).isZero();
        assertThat(env.moves.findByGameId(GAME_ID)).isEmpty();
    }

    @Test
    @DisplayName("非法走法被拒绝，不写着法日志")
    void illegalMoveRejected() {
        assertThatThrownBy(() -> session.applyMove(WHITE_ID, "e2", "e5", null))
                .isInstanceOf(ChessGameException.class)
                .hasMessage(GameMessages.ILLEGAL_MOVE);
        assertThat(session.getMoveCount()).isZero();
        assertThat(env.moves.findByGameId(GAME_ID)).isEmpty();
    }

    @Test
    @DisplayName("N 步之后步数为 N，着法日志按顺序记录，PGN 同步更新")
    void movesAreCountedAndLogged() {
        session.applyMove(WHITE_ID, "e2", "e4", null);
        session.applyMove(blackId, "e7", "e5", null);
        session.applyMove(WHITE_ID, "g1", "f3", null);
        MoveOutcome last = session.applyMove(blackId, "b8", "c6", null);

        assertThat(session.getMoveCount()).isEqualTo(4);
        assertThat(last.moveNumber()).isEqualTo(4);
        assertThat(last.turn()).isEqualTo(PlayerColor.WHITE);
        assertThat(last.gameOver()).isNull();

        List<MoveRecord> log = env.moves.findByGameId(GAME_ID);
        assertThat(log).extracting(MoveRecord::getMoveNumber).containsExactly(1, 2, 3, 4);
        assertThat(log).extracting(MoveRecord::getSan).containsExactly("e4", "e5", "Nf3", "Nc6");
        assertThat(log).extracting(MoveRecord::getPlayerId).containsExactly(WHITE_ID, blackId, WHITE_ID, blackId);
        assertThat(log.get(3).getFenAfter()).isEqualTo(session.getFen());

        assertThat(env.games.findById(GAME_ID)).get()
                .satisfies(rec -> {
                    assertThat(rec.getPgn()).isEqualTo("1. e4 e5 2. Nf3 Nc6");
                    assertThat(rec.getFen()).isEqualTo(session.getFen());
                });
        assertThat(session.getState().getPgn()).isEqualTo("1. e4 e5 2. Nf3 Nc6");
    }

    @Test
    @DisplayName("将死结束对局并更新双方战绩")
    void checkmateCompletesGame() {
        session.applyMove(WHITE_ID, "f2", "f3", null);
        session.applyMove(blackId, "e7", "e5", null);
        session.applyMove(WHITE_ID, "g2", "g4", null);
        MoveOutcome mate = session.applyMove(blackId, "d8", "h4", null);

        assertThat(mate.gameOver()).isNotNull();
        assertThat(mate.gameOver().type()).isEqualTo(GameOverType.CHECKMATE);
        assertThat(mate.gameOver().winner()).isEqualTo(PlayerColor.BLACK);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.getResult()).isEqualTo(GameResult.BLACK_WINS);
        assertThat(env.games.findById(GAME_ID)).get()
                .satisfies(rec -> assertThat(rec.getResult()).isEqualTo(GameResult.BLACK_WINS));
        assertThat(env.players.findById(blackId)).get()
                .satisfies(p -> assertThat(p.getScore()).isEqualTo(3));

        assertThatThrownBy(() -> session.applyMove(WHITE_ID, "e2", "e4", null))
                .isInstanceOf(ChessGameException.class)
                .extracting(e -> ((ChessGameException) e).getKind())
                .isEqualTo(ErrorKind.GAME_NOT_ACTIVE);
    }

    @Test
    @DisplayName("终局写入失败时内存与持久化状态都保持不变，重试同一步只记一次")
    void failedCompletionWriteKeepsMemoryState() {
        session.applyMove(WHITE_ID, "f2", "f3", null);
        session.applyMove(blackId, "e7", "e5", null);
        session.applyMove(WHITE_ID, "g2", "g4", null);
        String before = session.getFen();
        env.games.failNextCompletion();

        assertThatThrownBy(() -> session.applyMove(blackId, "d8", "h4", null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(session.getFen()).isEqualTo(before);
        assertThat(session.getMoveCount()).isEqualTo(3);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(env.moves.findByGameId(GAME_ID)).extracting(MoveRecord::getMoveNumber).containsExactly(1, 2, 3);
        assertThat(env.games.findById(GAME_ID)).get()
                .satisfies(rec -> {
                    assertThat(rec.getFen()).isEqualTo(before);
                    assertThat(rec.getPgn()).isEqualTo("1. f3 e5 2. g4");
                    assertThat(rec.getStatus()).isEqualTo(SessionStatus.ACTIVE);
                });

        MoveOutcome retried = session.applyMove(blackId, "d8", "h4", null);

        assertThat(retried.moveNumber()).isEqualTo(4);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(env.moves.findByGameId(GAME_ID))
                .extracting(MoveRecord::getMoveNumber).containsExactly(1, 2, 3, 4);
        assertThat(env.moves.findByGameId(GAME_ID).get(3).getSan()).isEqualTo("Qh4#");
        assertThat(env.games.completions(GAME_ID)).isEqualTo(1);
    }

    @Test
    @DisplayName("认输：对方获胜；非本局玩家认输为空操作")
    void resign() {
        assertThat(session.resign("stranger")).isEmpty();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);

        Optional<GameOver> over = session.resign(blackId);
        assertThat(over).isPresent();
        assertThat(over.get().type()).isEqualTo(GameOverType.RESIGNATION);
        assertThat(over.get().result()).isEqualTo(GameResult.WHITE_WINS);
        assertThat(session.resign(WHITE_ID)).isEmpty();
    }

    @Test
    @DisplayName("接受自己的提和不会结束对局，对方接受后和棋")
    void acceptingOwnDrawOfferIsRejected() {
        DrawResponse offer = session.offerDraw(WHITE_ID);
        assertThat(offer.accepted()).isTrue();
        assertThat(offer.offeredBy()).isEqualTo(PlayerColor.WHITE);
        assertThat(session.offerDraw(WHITE_ID).rejectReason()).isEqualTo(GameMessages.DRAW_ALREADY_OFFERED);

        DrawResponse own = session.acceptDraw(WHITE_ID);
        assertThat(own.accepted()).isFalse();
        assertThat(own.rejectReason()).isEqualTo(GameMessages.OWN_DRAW_OFFER);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.getDrawOfferBy()).isEqualTo(WHITE_ID);

        DrawResponse agreed = session.acceptDraw(blackId);
        assertThat(agreed.accepted()).isTrue();
        assertThat(agreed.gameOver().type()).isEqualTo(GameOverType.DRAW_AGREED);
        assertThat(session.getResult()).isEqualTo(GameResult.DRAW);
        assertThat(env.players.findById(WHITE_ID)).get()
                .extracting(PlayerRecord::getDraws, PlayerRecord::getScore)
                .containsExactly(1, 1);
    }

    @Test
    @DisplayName("没有待处理提和时拒绝和棋两次都是空操作")
    void declineTwiceIsNoOp() {
        session.offerDraw(WHITE_ID);
        assertThat(session.declineDraw(blackId).accepted()).isTrue();
        assertThat(session.getDrawOfferBy()).isNull();

        DrawResponse again = session.declineDraw(blackId);
        assertThat(again.accepted()).isFalse();
        assertThat(again.rejectReason()).isEqualTo(GameMessages.NO_DRAW_OFFER);
        assertThat(session.declineDraw(blackId).accepted()).isFalse();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    @DisplayName("落子清除待处理的提和")
    void moveClearsDrawOffer() {
        session.offerDraw(blackId);
        session.applyMove(WHITE_ID, "e2", "e4", null);
        assertThat(session.getDrawOfferBy()).isNull();
        assertThat(session.acceptDraw(WHITE_ID).rejectReason()).isEqualTo(GameMessages.NO_DRAW_OFFER);
    }

    @Test
    @DisplayName("宽限期内重连取消掉线计时，对局继续")
    void reconnectWithinGraceCancelsTimer() {
        session.attach(WHITE_ID, "s-white");
        session.attach(blackId, "s-black");

        assertThat(session.detach(WHITE_ID, "s-white", over -> { })).contains(PlayerColor.WHITE);
        assertThat(session.isConnected(PlayerColor.WHITE)).isFalse();
        assertThat(session.hasGraceTimer(WHITE_ID)).isTrue();

        session.attach(WHITE_ID, "s-white-2");
        assertThat(session.hasGraceTimer(WHITE_ID)).isFalse();
        assertThat(env.timers.fire("grace:")).isZero();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.socketOf(PlayerColor.WHITE)).isEqualTo("s-white-2");
    }

    @Test
    @DisplayName("宽限期满未重连，对方因掉线获胜")
    void graceExpiryAbandonsGame() {
        session.attach(WHITE_ID, "s-white");
        session.attach(blackId, "s-black");
        List<GameOver> announced = new ArrayList<>();

        session.detach(blackId, "s-black", announced::add);
        assertThat(env.timers.fire("grace:")).isEqualTo(1);

        assertThat(announced).singleElement().satisfies(over -> {
            assertThat(over.type()).isEqualTo(GameOverType.ABANDONMENT);
            assertThat(over.winner()).isEqualTo(PlayerColor.WHITE);
            assertThat(over.message()).isEqualTo("black player disconnected");
        });
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.getResult()).isEqualTo(GameResult.WHITE_WINS);
        assertThat(env.players.findById(blackId)).get()
                .extracting(PlayerRecord::getLosses).isEqualTo(1);
    }

    @Test
    @DisplayName("计时器在登记完成前就触发（宽限期为零），掉线方仍被判负")
    void graceTimerFiringDuringScheduleStillForfeits() {
        GraceTimerScheduler immediate = (key, delay, task) -> {
            task.run();
            return new GraceTimerScheduler.TimerHandle() {
                @Override
                public boolean cancel() {
                    return false;
                }

                @Override
                public boolean isDone() {
                    return true;
                }
            };
        };
        ChessSession quick = ChessSession.create(env.context(immediate, Duration.ZERO), "g-quick", WHITE_ID);
        env.games.create("g-quick", WHITE_ID, quick.getFen());
        String black = quick.join("Bob");
        quick.attach(WHITE_ID, "s-white");
        quick.attach(black, "s-black");
        List<GameOver> announced = new ArrayList<>();

        assertThat(quick.detach(black, "s-black", announced::add)).contains(PlayerColor.BLACK);

        assertThat(quick.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(quick.getResult()).isEqualTo(GameResult.WHITE_WINS);
        assertThat(quick.hasGraceTimer(black)).isFalse();
        assertThat(announced).singleElement()
                .extracting(GameOver::type).isEqualTo(GameOverType.ABANDONMENT);
    }

    @Test
    @DisplayName("对局结束后掉线计时触发为空操作")
    void timerAfterGameEndIsNoOp() {
        session.attach(WHITE_ID, "s-white");
        session.attach(blackId, "s-black");
        List<GameOver> announced = new ArrayList<>();
        session.detach(WHITE_ID, "s-white", announced::add);

        session.resign(blackId);

        assertThat(env.timers.fire("grace:")).isZero();
        assertThat(announced).isEmpty();
        assertThat(session.getResult()).isEqualTo(GameResult.WHITE_WINS);
    }

    @Test
    @DisplayName("已被新连接替换的旧连接断开被忽略")
    void staleSocketDetachIgnored() {
        session.attach(WHITE_ID, "s-old");
        session.attach(WHITE_ID, "s-new");

        assertThat(session.detach(WHITE_ID, "s-old", over -> { })).isEmpty();
        assertThat(session.isConnected(PlayerColor.WHITE)).isTrue();
        assertThat(session.hasGraceTimer(WHITE_ID)).isFalse();
    }

    @Test
    @DisplayName("非本局玩家不能绑定连接")
    void attachByStrangerFails() {
        assertThatThrownBy(() -> session.attach("stranger", "s-x"))
                .isInstanceOf(ChessGameException.class)
                .extracting(e -> ((ChessGameException) e).getKind())
                .isEqualTo(ErrorKind.NOT_A_PLAYER);
    }

    @Test
    @DisplayName("双方都在线后 game-ready 只触发一次")
    void readyBroadcastOnlyOnce() {
        session.attach(WHITE_ID, "s-white");
        assertThat(session.markReadyBroadcast()).isFalse();
        session.attach(blackId, "s-black");
        assertThat(session.markReadyBroadcast()).isTrue();
        assertThat(session.markReadyBroadcast()).isFalse();
    }

    @Test
    @DisplayName("快照包含合法走法表与连接状态")
    void stateSnapshot() {
        session.attach(WHITE_ID, "s-white");
        SessionState state = session.getState();

        assertThat(state.getFen()).isEqualTo(ChessPosition.START_FEN);
        assertThat(state.getTurn()).isEqualTo(PlayerColor.WHITE);
        assertThat(state.isWhiteConnected()).isTrue();
        assertThat(state.isBlackConnected()).isFalse();
        assertThat(state.getLegalMoves()).containsKey("e2");
        assertThat(state.getLegalMoves().get("e2")).containsExactlyInAnyOrder("e3", "e4");
        assertThat(state.getLegalMoves().values().stream().mapToInt(java.util.Set::size).sum()).isEqualTo(20);
    }
}
