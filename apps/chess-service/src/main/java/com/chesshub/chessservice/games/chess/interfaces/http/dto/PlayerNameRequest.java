package com.chesshub.chessservice.games.chess.interfaces.http.dto;

import lombok.Data;

/** 创建 / 加入对局请求体 */
@Data
public class PlayerNameRequest {
    private String playerName;
}
