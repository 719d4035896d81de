package com.chesshub.chessservice.games.chess.interfaces.http;

import com.chesshub.chessservice.games.chess.application.GameHistoryService;
import com.chesshub.chessservice.games.chess.application.dto.GameSummaryView;
import com.chesshub.chessservice.games.chess.domain.dto.MoveRecord;
import com.chesshub.chessservice.games.chess.domain.model.JoinResult;
import com.chesshub.chessservice.games.chess.domain.model.ReconnectResult;
import com.chesshub.chessservice.games.chess.interfaces.http.dto.PlayerNameRequest;
import com.chesshub.chessservice.games.chess.interfaces.http.dto.ReconnectRequest;
import com.chesshub.chessservice.games.chess.service.ChessSessionRegistry;
import com.chesshub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 国际象棋对局 http 接口
 * ----------------------------------------------------
 * 创建 / 加入 / 重连拿到 (gameId, playerId, color) 后，客户端再通过 WebSocket 发送 join-game 绑定连接。
 * 业务失败统一抛 ChessGameException，由 WebExceptionAdvice 映射为对应状态码。
 */
@Slf4j
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class ChessRestController {

    private final ChessSessionRegistry registry;
    private final GameHistoryService history;

    /**
     * 新建对局：创建者执白，等待对手加入
     */
    @PostMapping
    public ResponseEntity<ApiResponse<JoinResult>> create(@RequestBody(required = false) PlayerNameRequest req) {
        String name = PlayerNames.sanitize(req == null ? null : req.getPlayerName());
        return ResponseEntity.ok(ApiResponse.success(registry.create(name)));
    }

    /**
     * 加入对局：加入者执黑，对局进入 active
     */
    @PostMapping("/{gameId}/join")
    public ResponseEntity<ApiResponse<JoinResult>> join(@PathVariable String gameId,
                                                        @RequestBody(required = false) PlayerNameRequest req) {
        String name = PlayerNames.sanitize(req == null ? null : req.getPlayerName());
        return ResponseEntity.ok(ApiResponse.success(registry.join(gameId, name)));
    }

    /**
     * 重连：页面刷新或进程重启后按 playerId 找回座位；已结束的对局只返回结果
     */
    @PostMapping("/{gameId}/reconnect")
    public ResponseEntity<ApiResponse<ReconnectResult>> reconnect(@PathVariable String gameId,
                                                                  @RequestBody(required = false) ReconnectRequest req) {
        String playerId = req == null ? null : req.getPlayerId();
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException("Player ID required");
        }
        return ResponseEntity.ok(ApiResponse.success(registry.reconnect(gameId, playerId)));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<ApiResponse<GameSummaryView>> summary(@PathVariable String gameId) {
        return ResponseEntity.ok(ApiResponse.success(history.summary(gameId)));
    }

    /** 着法日志，按步号升序 */
    @GetMapping("/{gameId}/moves")
    public ResponseEntity<ApiResponse<List<MoveRecord>>> moves(@PathVariable String gameId) {
        return ResponseEntity.ok(ApiResponse.success(history.moves(gameId)));
    }
}
