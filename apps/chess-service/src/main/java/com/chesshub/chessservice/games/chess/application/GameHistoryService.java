package com.chesshub.chessservice.games.chess.application;

import com.chesshub.chessservice.games.chess.application.dto.GameSummaryView;
import com.chesshub.chessservice.games.chess.domain.dto.GameRecord;
import com.chesshub.chessservice.games.chess.domain.dto.GameStats;
import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;
import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import com.chesshub.chessservice.games.chess.domain.exception.ChessGameException;
import com.chesshub.chessservice.games.chess.domain.exception.ErrorKind;
import com.chesshub.chessservice.games.chess.domain.repository.GameRecordRepository;
import com.chesshub.chessservice.games.chess.domain.repository.MoveRepository;
import com.chesshub.chessservice.games.chess.domain.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 对局历史与统计查询（只读，直接走持久化层，不触碰内存对局）
 */
@Service
@RequiredArgsConstructor
public class GameHistoryService {

    private final PlayerRepository players;
    private final GameRecordRepository games;
    private final MoveRepository moves;

    /**
     * 单盘概要；不存在时抛 GAME_NOT_FOUND
     */
    public GameSummaryView summary(String gameId) {
        GameRecord rec = games.findById(gameId)
                .orElseThrow(() -> new ChessGameException(ErrorKind.GAME_NOT_FOUND));
        return toView(rec, new HashMap<>());
    }

    /** 着法日志（未知对局返回空列表） */
    public List<MoveRecord> moves(String gameId) {
        return moves.findByGameId(gameId);
    }

    public List<PlayerRecord> leaderboard(int limit) {
        return players.leaderboard(limit);
    }

    /**
     * 最近完成的对局，名字按玩家ID在本次查询内缓存
     */
    public List<GameSummaryView> recentGames(int limit) {
        Map<String, String> names = new HashMap<>();
        return games.recentCompleted(limit).stream()
                .map(rec -> toView(rec, names))
                .toList();
    }

    public GameStats stats() {
        long completed = games.countByStatus(SessionStatus.COMPLETED);
        long live = games.countByStatus(SessionStatus.WAITING) + games.countByStatus(SessionStatus.ACTIVE);
        return new GameStats(completed, players.count(), live);
    }

    private GameSummaryView toView(GameRecord rec, Map<String, String> names) {
        return GameSummaryView.of(rec, nameOf(rec.getWhitePlayerId(), names), nameOf(rec.getBlackPlayerId(), names));
    }

    private String nameOf(String playerId, Map<String, String> names) {
        if (playerId == null) {
            return null;
        }
        return names.computeIfAbsent(playerId, id -> players.findById(id)
                .map(PlayerRecord::getDisplayName)
                .orElse(null));
    }
}
