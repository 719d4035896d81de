package com.chesshub.chessservice.games.chess.interfaces.http.dto;

import lombok.Data;

@Data
public class ReconnectRequest {
    private String playerId;
}
