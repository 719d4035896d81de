package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;

/** 创建/加入对局的结果：对局ID、新玩家ID、执子颜色 */
public record JoinResult(String gameId, String playerId, PlayerColor color) {
}
