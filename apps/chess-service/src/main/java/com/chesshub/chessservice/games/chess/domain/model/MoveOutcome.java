package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.rule.AppliedMove;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一步棋被接受后的结果：走法、走后局面、行棋方、是否将军、步号、合法走法表以及可能的终局。
 */
public record MoveOutcome(AppliedMove move,
                          String fen,
                          PlayerColor turn,
                          boolean inCheck,
                          int moveNumber,
                          Map<String, Set<String>> legalMoves,
                          GameOver gameOver) {

    public Optional<GameOver> gameOverOpt() {
        return Optional.ofNullable(gameOver);
    }
}
