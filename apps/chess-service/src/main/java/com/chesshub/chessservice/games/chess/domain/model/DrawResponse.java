package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;

/**
 * 和棋协商（提和/接受/拒绝）的结果。
 * 被拒绝时 accepted=false 且 rejectReason 说明原因，对局状态不变。
 *
 * @param offeredBy 提和成功时为提和方颜色
 * @param gameOver  接受和棋时的终局
 */
public record DrawResponse(boolean accepted,
                           String rejectReason,
                           PlayerColor offeredBy,
                           GameOver gameOver) {

    public static DrawResponse rejected(String reason) {
        return new DrawResponse(false, reason, null, null);
    }

    public static DrawResponse offered(PlayerColor by) {
        return new DrawResponse(true, null, by, null);
    }

    public static DrawResponse declined() {
        return new DrawResponse(true, null, null, null);
    }

    public static DrawResponse agreed(GameOver gameOver) {
        return new DrawResponse(true, null, null, gameOver);
    }
}
