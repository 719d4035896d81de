package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 重连结果
 * - 对局仍在进行/等待：reconnected=true；
 * - 对局已结束：completed=true，附带结果与最终局面，不恢复内存对局。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconnectResult(String gameId,
                              String playerId,
                              PlayerColor color,
                              Boolean reconnected,
                              Boolean completed,
                              GameResult result,
                              String fen) {

    public static ReconnectResult live(String gameId, String playerId, PlayerColor color) {
        return new ReconnectResult(gameId, playerId, color, true, null, null, null);
    }

    public static ReconnectResult finished(String gameId, String playerId, PlayerColor color,
                                           GameResult result, String fen) {
        return new ReconnectResult(gameId, playerId, color, null, true, result, fen);
    }

    public boolean ended() {
        return Boolean.TRUE.equals(completed);
    }
}
