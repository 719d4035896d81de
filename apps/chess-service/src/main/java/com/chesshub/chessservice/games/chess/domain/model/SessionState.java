package com.chesshub.chessservice.games.chess.domain.model;

import com.chesshub.chessservice.games.chess.domain.enums.GameResult;
import com.chesshub.chessservice.games.chess.domain.enums.PlayerColor;
import com.chesshub.chessservice.games.chess.domain.enums.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * 对局只读快照（game-state 事件的主体，另由协议层补充 yourColor 与双方名字）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionState {
    private String gameId;
    private String fen;
    private String pgn;
    /** 当前行棋方 */
    private PlayerColor turn;
    private SessionStatus status;
    private boolean inCheck;
    /** 局面本身是否已分胜负/和棋（与 status 无关） */
    private boolean gameOver;
    private String whitePlayerId;
    private String blackPlayerId;
    private boolean whiteConnected;
    private boolean blackConnected;
    private int moveCount;
    /** 提和方玩家ID，无则 null */
    private String drawOffer;
    /** 起点格 → 可达终点格 */
    private Map<String, Set<String>> legalMoves;
    private GameResult result;
}
