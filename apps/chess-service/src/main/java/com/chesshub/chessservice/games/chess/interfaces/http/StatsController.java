package com.chesshub.chessservice.games.chess.interfaces.http;

import com.chesshub.chessservice.games.chess.application.GameHistoryService;
import com.chesshub.chessservice.games.chess.application.dto.GameSummaryView;
import com.chesshub.chessservice.games.chess.domain.dto.GameStats;
import com.chesshub.chessservice.games.chess.domain.dto.PlayerRecord;
import com.chesshub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 大厅展示用的只读查询：排行榜、最近对局、全站统计。
 *
 * 不做鉴权，前端可直接调用。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatsController {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LEADERBOARD = 100;
    static final int MAX_RECENT = 50;

    private final GameHistoryService history;

    /**
     * 排行榜：积分降序，积分相同按胜场降序
     * @param limit 条数，默认 20，最多 100
     */
    @GetMapping("/leaderboard")
    public ApiResponse<List<PlayerRecord>> leaderboard(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(history.leaderboard(clamp(limit, MAX_LEADERBOARD)));
    }

    /**
     * 最近完成的对局
     * @param limit 条数，默认 20，最多 50
     */
    @GetMapping("/recent-games")
    public ApiResponse<List<GameSummaryView>> recentGames(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(history.recentGames(clamp(limit, MAX_RECENT)));
    }

    @GetMapping("/stats")
    public ApiResponse<GameStats> stats() {
        return ApiResponse.success(history.stats());
    }

    /** 未传或非正数取默认值，超出上限取上限 */
    static int clamp(Integer limit, int max) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, max);
    }
}
