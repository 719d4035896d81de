package com.chesshub.chessservice.games.chess.domain.dto;

import lombok.Data;

/**
 * 单步着法记录（只追加，每步成功落子写一次）。
 * moveNumber 从 1 开始，等于该步被接受时的走子计数。
 */
@Data
public class MoveRecord {
    private String gameId;
    private int moveNumber;
    private String playerId;
    private String from;
    private String to;
    private String san;
    private String fenAfter;
    private long createdAt;
}
