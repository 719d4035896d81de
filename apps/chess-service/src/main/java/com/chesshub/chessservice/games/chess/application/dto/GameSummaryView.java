package com.chesshub.chessservice.games.chess.application.dto;

import com.chesshub.chessservice.games.chess.domain.dto.GameRecord;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;

/**
 * 对局概要（对局详情与最近对局列表共用）
 * - 名字由玩家档案补全，对手尚未加入时 blackName 为 null；
 * - result 在对局结束前为 null。
 */
public record GameSummaryView(String id,
                              SessionStatus status,
                              GameResult result,
                              String whiteName,
                              String blackName,
                              String pgn,
                              long createdAt,
                              long updatedAt) {

    public static GameSummaryView of(GameRecord rec, String whiteName, String blackName) {
        return new GameSummaryView(rec.getId(), rec.getStatus(), rec.getResult(),
                whiteName, blackName, rec.getPgn(), rec.getCreatedAt(), rec.getUpdatedAt());
    }
}
