package com.chesshub.chessservice.games.chess.domain.dto;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import lombok.Data;

/**
 * GameRecord
 * -------------------------------------------------------
 * 单盘对局的持久化记录（冷启动恢复的唯一依据）。
 * - fen 为最近一次落子后的局面；pgn 为 SAN 着法文本；
 * - result 在 status=COMPLETED 之前为 null。
 */
@Data
public class GameRecord {
    /** 对局ID（8 位 URL 安全字符串） */
    private String id;
    private String whitePlayerId;
    /** 等待对手时为 null */
    private String blackPlayerId;
    private SessionStatus status;
    private GameResult result;
    private String fen;
    private String pgn;
    private long createdAt;
    private long updatedAt;
}
