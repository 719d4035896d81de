package com.chesshub.chessservice.games.chess.domain.rule;

/**
 * 规则引擎接受一步棋后的结果：走法本身、SAN 记谱、走子/吃子（小写棋子字母）与走后的 FEN。
 */
public record AppliedMove(String from,
                          String to,
                          String promotion,
                          String san,
                          String piece,
                          String captured,
                          String fenAfter) {
}
