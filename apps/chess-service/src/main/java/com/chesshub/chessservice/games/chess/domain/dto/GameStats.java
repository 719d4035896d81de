package com.chesshub.chessservice.games.chess.domain.dto;

/**
 * 全站统计：已完成对局数、玩家数、进行中（含等待中）对局数。
 */
public record GameStats(long totalGames, long totalPlayers, long activeGames) {
}
