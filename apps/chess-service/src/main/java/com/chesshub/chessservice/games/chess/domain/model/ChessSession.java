package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.clock.scheduler.GraceTimerScheduler.TimerHandle;
import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;
import com.chesshub.chessservice.games.chess.domain.dto.GameRecord;
import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;
import com.chesshub.chessservice.games.chess.domain.enums.GameOverType;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import com.chesshub.chessservice.games.chess.domain.exception.ChessGameException;
import com.chesshub.chessservice.games.chess.domain.exception.ErrorKind;
import com.chesshub.chessservice.games.chess.domain.rule.AppliedMove;
import com.chesshub.chessservice.games.chess.domain.rule.ChessPosition;
import com.chesshub.chessservice.games.chess.domain.rule.Classification;
import com.chesshub.chessservice.games.chess.domain.rule.LegalMove;
import com.chesshub.chessservice.games.chess.domain.rule.Pgn;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 单盘对局的权威状态机
 * ----------------------------------------
 * 生命周期：WAITING → ACTIVE → COMPLETED（ABANDONED 保留不用）。
 *
 * 并发：所有修改都在本对局的 ReentrantLock 下串行执行；锁可重入，
 * 协议层可用 {@link #withLock(Supplier)} 把“修改 + 广播”包在同一临界区，保证广播顺序与提交顺序一致。
 *
 * 持久化：落子先作用于局面副本，着法/局面/终局/战绩全部写成功后才提交到内存；
 * 任一写入失败则内存状态不变、已写入的着法回滚，异常原样上抛。
 */
@Slf4j
public class ChessSession {

    private final ReentrantLock lock = new ReentrantLock();
    private final ChessSessionContext ctx;

    // ---- 身份 ----
    @Getter
    private final String id;
    @Getter
    private final String whitePlayerId;
    @Getter
    private volatile String blackPlayerId;

    // ---- 连接 ----
    private volatile String whiteSocketId;
    private volatile String blackSocketId;
    private volatile boolean whiteConnected;
    private volatile boolean blackConnected;

    // ---- 棋局 ----
    private ChessPosition position;
    private List<String> sanMoves;
    @Getter
    private volatile int moveCount;
    @Getter
    private volatile SessionStatus status;
    @Getter
    private volatile String drawOfferBy;
    @Getter
    private volatile GameResult result;

    /** playerId -> 掉线宽限计时（仅宽限期内存在） */
    private final Map<String, GraceTimer> graceTimers = new HashMap<>();
    private boolean readyBroadcastSent;

    private ChessSession(ChessSessionContext ctx, String id, String whitePlayerId, String blackPlayerId,
                         ChessPosition position, List<String> sanMoves, SessionStatus status, GameResult result) {
        this.ctx = ctx;
        this.id = id;
        this.whitePlayerId = whitePlayerId;
        this.blackPlayerId = blackPlayerId;
        this.position = position;
        this.sanMoves = sanMoves;
        this.moveCount = sanMoves.size();
        this.status = status;
        this.result = result;
    }

    /**
     * 新建等待对手的对局（房主执白）
     */
    public static ChessSession create(ChessSessionContext ctx, String id, String whitePlayerId) {
        return new ChessSession(ctx, id, whitePlayerId, null,
                ctx.rules().initialPosition(), new ArrayList<>(), SessionStatus.WAITING, null);
    }

    /**
     * 冷启动恢复：局面取记录中最新 FEN，步数取着法日志长度。
     */
    public static ChessSession restore(ChessSessionContext ctx, GameRecord rec, List<MoveRecord> moves) {
        ChessPosition pos = rec.getFen() == null
                ? ctx.rules().initialPosition()
                : ctx.rules().fromFen(rec.getFen());
        List<String> sans = new ArrayList<>(moves.size());
        for (MoveRecord m : moves) {
            sans.add(m.getSan());
        }
        SessionStatus st = rec.getStatus() == null ? SessionStatus.WAITING : rec.getStatus();
        return new ChessSession(ctx, rec.getId(), rec.getWhitePlayerId(), rec.getBlackPlayerId(),
                pos, sans, st, rec.getResult());
    }

    // ==========================================================
    // 临界区
    // ==========================================================

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    // ==========================================================
    // 加入
    // ==========================================================

    /**
     * 黑方加入：创建玩家、持久化加入、状态 WAITING → ACTIVE。
     * @return 新玩家ID
     */
    public String join(String displayName) {
        return withLock(() -> {
            if (status != SessionStatus.WAITING) {
                throw new ChessGameException(ErrorKind.GAME_ALREADY_STARTED);
            }
            if (blackPlayerId != null) {
                throw new ChessGameException(ErrorKind.GAME_FULL);
            }
            String playerId = UUID.randomUUID().toString();
            ctx.players().create(playerId, displayName);
            ctx.games().recordJoin(id, playerId);
            blackPlayerId = playerId;
            status = SessionStatus.ACTIVE;
            log.info("player joined: game={}, black={}", id, playerId);
            return playerId;
        });
    }

    // ==========================================================
    // 落子
    // ==========================================================

    public MoveOutcome applyMove(String playerId, String from, String to, String promotion) {
        return withLock(() -> {
            PlayerColor color = colorOf(playerId);
            if (color == null || color != position.turn()) {
                throw new ChessGameException(ErrorKind.NOT_YOUR_TURN);
            }
            if (status != SessionStatus.ACTIVE) {
                throw new ChessGameException(ErrorKind.GAME_NOT_ACTIVE);
            }

            ChessPosition next = position.copy();
            AppliedMove applied = ctx.rules().applyMove(next, from, to, promotion)
                    .orElseThrow(() -> new ChessGameException(ErrorKind.ILLEGAL_MOVE));
            Classification cls = ctx.rules().classify(next);

            int number = moveCount + 1;
            List<String> nextSans = new ArrayList<>(sanMoves);
            nextSans.add(applied.san());

            MoveRecord rec = new MoveRecord();
            rec.setGameId(id);
            rec.setMoveNumber(number);
            rec.setPlayerId(playerId);
            rec.setFrom(from);
            rec.setTo(to);
            rec.setSan(applied.san());
            rec.setFenAfter(applied.fenAfter());
            rec.setCreatedAt(System.currentTimeMillis());

            GameOver over = cls.isTerminal() ? gameOverOf(cls, next.turn()) : null;
            ctx.moves().append(rec);
            try {
                ctx.games().updatePosition(id, applied.fenAfter(), Pgn.movetext(nextSans));
                if (over != null) {
                    persistCompletion(over.result());
                }
            } catch (RuntimeException e) {
                rollbackMove(number, e);
                throw e;
            }

            // 全部写入成功，提交内存状态
            position = next;
            sanMoves = nextSans;
            moveCount = number;
            drawOfferBy = null;
            if (over != null) {
                finish(over);
            }
            return new MoveOutcome(applied, applied.fenAfter(), next.turn(), cls.inCheck(),
                    number, legalMovesOf(next), over);
        });
    }

    /**
     * 着法已写入但后续写入失败：删掉这一步并把局面快照还原到内存中的已提交局面。
     * 回滚本身失败时只附加到原异常上，重试同一步号会覆盖残留记录。
     */
    private void rollbackMove(int number, RuntimeException cause) {
        try {
            ctx.moves().remove(id, number);
            ctx.games().updatePosition(id, position.toFen(), Pgn.movetext(sanMoves));
            log.warn("move write rolled back: game={}, moveNumber={}", id, number);
        } catch (RuntimeException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("move rollback failed: game={}, moveNumber={}", id, number, rollbackFailure);
        }
    }

    private static GameOver gameOverOf(Classification cls, PlayerColor sideToMove) {
        return switch (cls.kind()) {
            case CHECKMATE -> GameOver.win(GameOverType.CHECKMATE, sideToMove.opposite());
            case STALEMATE -> GameOver.draw(GameOverType.STALEMATE, null);
            default -> GameOver.draw(GameOverType.DRAW, cls.reason());
        };
    }

    // ==========================================================
    // 认输 / 和棋
    // ==========================================================

    /**
     * 认输：对局未进行中或玩家不属于本局时为空操作。
     */
    public Optional<GameOver> resign(String playerId) {
        return withLock(() -> {
            PlayerColor color = colorOf(playerId);
            if (status != SessionStatus.ACTIVE || color == null) {
                return Optional.empty();
            }
            GameOver over = GameOver.win(GameOverType.RESIGNATION, color.opposite());
            persistCompletion(over.result());
            finish(over);
            return Optional.of(over);
        });
    }

    public DrawResponse offerDraw(String playerId) {
        return withLock(() -> {
            if (status != SessionStatus.ACTIVE) {
                return DrawResponse.rejected(GameMessages.GAME_NOT_ACTIVE);
            }
            PlayerColor color = colorOf(playerId);
            if (color == null) {
                return DrawResponse.rejected(GameMessages.NOT_A_PLAYER);
            }
            if (playerId.equals(drawOfferBy)) {
                return DrawResponse.rejected(GameMessages.DRAW_ALREADY_OFFERED);
            }
            drawOfferBy = playerId;
            return DrawResponse.offered(color);
        });
    }

    public DrawResponse acceptDraw(String playerId) {
        return withLock(() -> {
            String reject = drawAnswerGuard(playerId);
            if (reject != null) {
                return DrawResponse.rejected(reject);
            }
            GameOver over = GameOver.draw(GameOverType.DRAW_AGREED, null);
            persistCompletion(over.result());
            finish(over);
            return DrawResponse.agreed(over);
        });
    }

    public DrawResponse declineDraw(String playerId) {
        return withLock(() -> {
            String reject = drawAnswerGuard(playerId);
            if (reject != null) {
                return DrawResponse.rejected(reject);
            }
            drawOfferBy = null;
            return DrawResponse.declined();
        });
    }

    /** 应答和棋的前置条件；通过返回 null */
    private String drawAnswerGuard(String playerId) {
        if (status != SessionStatus.ACTIVE) return GameMessages.GAME_NOT_ACTIVE;
        if (colorOf(playerId) == null) return GameMessages.NOT_A_PLAYER;
        if (drawOfferBy == null) return GameMessages.NO_DRAW_OFFER;
        if (drawOfferBy.equals(playerId)) return GameMessages.OWN_DRAW_OFFER;
        return null;
    }

    // ==========================================================
    // 连接 / 掉线
    // ==========================================================

    /**
     * 绑定连接：标记在线、记录连接ID，并取消该玩家自己的掉线计时。
     */
    public PlayerColor attach(String playerId, String socketId) {
        return withLock(() -> {
            PlayerColor color = colorOf(playerId);
            if (color == null) {
                throw new ChessGameException(ErrorKind.NOT_A_PLAYER, GameMessages.NOT_A_PLAYER);
            }
            if (color == PlayerColor.WHITE) {
                whiteSocketId = socketId;
                whiteConnected = true;
            } else {
                blackSocketId = socketId;
                blackConnected = true;
            }
            GraceTimer pending = graceTimers.remove(playerId);
            if (pending != null) {
                pending.cancel();
                log.info("grace timer cancelled on reconnect: game={}, player={}", id, playerId);
            }
            return color;
        });
    }

    /**
     * 断开连接：过期连接（已被新连接替换）忽略；否则标记离线，进行中的对局启动掉线宽限计时。
     *
     * @param onAbandon 宽限期满判负时回调（持锁执行）
     * @return 实际断开的颜色；忽略时为 empty
     */
    public Optional<PlayerColor> detach(String playerId, String socketId, Consumer<GameOver> onAbandon) {
        return withLock(() -> {
            PlayerColor color = colorOf(playerId);
            if (color == null) {
                return Optional.empty();
            }
            if (!Objects.equals(socketOf(color), socketId)) {
                log.warn("stale socket disconnect ignored: game={}, player={}, socket={}", id, playerId, socketId);
                return Optional.empty();
            }
            if (color == PlayerColor.WHITE) {
                whiteSocketId = null;
                whiteConnected = false;
            } else {
                blackSocketId = null;
                blackConnected = false;
            }
            if (status == SessionStatus.ACTIVE) {
                startGraceTimer(playerId, onAbandon);
            }
            return Optional.of(color);
        });
    }

    private void startGraceTimer(String playerId, Consumer<GameOver> onAbandon) {
        GraceTimer previous = graceTimers.remove(playerId);
        if (previous != null) {
            previous.cancel();
        }
        // 先登记再调度，回调按登记对象判断自己是否已被取代
        GraceTimer timer = new GraceTimer();
        graceTimers.put(playerId, timer);
        timer.handle = ctx.timers().schedule(
                "grace:" + id + ":" + playerId,
                ctx.gracePeriod(),
                () -> onGraceExpired(playerId, timer, onAbandon));
        log.info("grace timer started: game={}, player={}, seconds={}", id, playerId, ctx.gracePeriod().toSeconds());
    }

    private void onGraceExpired(String playerId, GraceTimer timer, Consumer<GameOver> onAbandon) {
        withLock(() -> {
            if (graceTimers.get(playerId) != timer) {
                log.debug("grace timer superseded: game={}, player={}", id, playerId);
                return;
            }
            graceTimers.remove(playerId);
            if (status != SessionStatus.ACTIVE) {
                log.debug("grace timer fired after game ended: game={}, player={}", id, playerId);
                return;
            }
            PlayerColor leaver = colorOf(playerId);
            GameOver over = GameOver.abandonment(leaver, GameMessages.formatPlayerDisconnected(leaver.wire()));
            persistCompletion(over.result());
            finish(over);
            log.info("game abandoned: game={}, leaver={}, result={}", id, leaver.wire(), over.result().wire());
            onAbandon.accept(over);
        });
    }

    /**
     * 双方都在线且对局进行中时，第一次调用返回 true，之后都返回 false。
     */
    public boolean markReadyBroadcast() {
        return withLock(() -> {
            if (readyBroadcastSent || status != SessionStatus.ACTIVE || !whiteConnected || !blackConnected) {
                return false;
            }
            readyBroadcastSent = true;
            return true;
        });
    }

    // ==========================================================
    // 终局
    // ==========================================================

    private void persistCompletion(GameResult res) {
        ctx.games().markCompleted(id, res);
        ctx.players().applyOutcome(whitePlayerId, res.outcomeFor(PlayerColor.WHITE));
        ctx.players().applyOutcome(blackPlayerId, res.outcomeFor(PlayerColor.BLACK));
    }

    private void finish(GameOver over) {
        status = SessionStatus.COMPLETED;
        result = over.result();
        drawOfferBy = null;
        graceTimers.values().forEach(GraceTimer::cancel);
        graceTimers.clear();
        log.info("game completed: game={}, type={}, result={}", id, over.type().wire(), over.result().wire());
    }

    // ==========================================================
    // 查询
    // ==========================================================

    public Map<String, Set<String>> getLegalMoves() {
        return withLock(() -> legalMovesOf(position));
    }

    private Map<String, Set<String>> legalMovesOf(ChessPosition pos) {
        Map<String, Set<String>> grouped = new LinkedHashMap<>();
        for (LegalMove m : ctx.rules().legalMoves(pos)) {
            grouped.computeIfAbsent(m.fromSquare(), k -> new LinkedHashSet<>()).add(m.toSquare());
        }
        return grouped;
    }

    public SessionState getState() {
        return withLock(() -> {
            Classification cls = ctx.rules().classify(position);
            return SessionState.builder()
                    .gameId(id)
                    .fen(position.toFen())
                    .pgn(Pgn.movetext(sanMoves))
                    .turn(position.turn())
                    .status(status)
                    .inCheck(cls.inCheck())
                    .gameOver(cls.isTerminal())
                    .whitePlayerId(whitePlayerId)
                    .blackPlayerId(blackPlayerId)
                    .whiteConnected(whiteConnected)
                    .blackConnected(blackConnected)
                    .moveCount(moveCount)
                    .drawOffer(drawOfferBy)
                    .legalMoves(legalMovesOf(position))
                    .result(result)
                    .build();
        });
    }

    /** 玩家执子颜色；不是本局玩家返回 null */
    public PlayerColor colorOf(String playerId) {
        if (playerId == null) return null;
        if (playerId.equals(whitePlayerId)) return PlayerColor.WHITE;
        if (playerId.equals(blackPlayerId)) return PlayerColor.BLACK;
        return null;
    }

    public String playerIdOf(PlayerColor color) {
        return color == PlayerColor.WHITE ? whitePlayerId : blackPlayerId;
    }

    public String socketOf(PlayerColor color) {
        return color == PlayerColor.WHITE ? whiteSocketId : blackSocketId;
    }

    public boolean isConnected(PlayerColor color) {
        return color == PlayerColor.WHITE ? whiteConnected : blackConnected;
    }

    /** 当前是否有该玩家的掉线计时在跑 */
    public boolean hasGraceTimer(String playerId) {
        return withLock(() -> graceTimers.containsKey(playerId));
    }

    public String getFen() {
        return withLock(() -> position.toFen());
    }

    /** 一次掉线宽限：登记对象本身即身份，句柄在调度后回填（只在持锁时读写） */
    private static final class GraceTimer {
        private TimerHandle handle;

        void cancel() {
            if (handle != null) {
                handle.cancel();
            }
        }
    }
}
