package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.GameOverType;
import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;

/**
 * 终局描述（一盘棋只会产生一次）
 *
 * @param type    终局方式
 * @param winner  胜方；和棋为 null
 * @param result  持久化结果
 * @param reason  和棋原因（仅 type=DRAW）
 * @param message 说明文字（仅掉线判负）
 */
public record GameOver(GameOverType type,
                       PlayerColor winner,
                       GameResult result,
                       String reason,
                       String message) {

    public static GameOver win(GameOverType type, PlayerColor winner) {
        return new GameOver(type, winner, GameResult.winFor(winner), null, null);
    }

    public static GameOver draw(GameOverType type, String reason) {
        return new GameOver(type, null, GameResult.DRAW, reason, null);
    }

    public static GameOver abandonment(PlayerColor leaver, String message) {
        PlayerColor winner = leaver.opposite();
        return new GameOver(GameOverType.ABANDONMENT, winner, GameResult.winFor(winner), null, message);
    }
}
