package com.chesshub.chessservice.games.chess.interfaces.ws;

import com.chesshub.chessservice.games.chess.application.ChessSyncHandler;
import com.chesshub.chessservice.games.chess.interfaces.ws.dto.ChessMessages.JoinGameCmd;
import com.chesshub.chessservice.games.chess.interfaces.ws.dto.ChessMessages.MakeMoveCmd;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Chess WebSocket 控制器
 * ----------------------------------------
 * 接收前端通过 STOMP 发送的指令（/app/chess.*），以 STOMP 会话ID 作为连接标识转交协议处理器。
 * 结果与错误全部由协议处理器推送，这里不直接回写。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChessWsController {

    private final ChessSyncHandler syncHandler;

    /**
     * 进入对局：/app/chess.join-game
     */
    @MessageMapping("/chess.join-game")
    public void joinGame(JoinGameCmd cmd, SimpMessageHeaderAccessor sha) {
        if (cmd == null || StringUtils.isAnyBlank(cmd.getGameId(), cmd.getPlayerId())) {
            log.warn("join-game with missing fields ignored: session={}", sha.getSessionId());
            return;
        }
        syncHandler.onJoinGame(sha.getSessionId(), cmd.getGameId(), cmd.getPlayerId());
    }

    /**
     * 落子：/app/chess.make-move
     */
    @MessageMapping("/chess.make-move")
    public void makeMove(MakeMoveCmd cmd, SimpMessageHeaderAccessor sha) {
        if (cmd == null) {
            return;
        }
        syncHandler.onMakeMove(sha.getSessionId(), cmd.getFrom(), cmd.getTo(),
                StringUtils.defaultIfBlank(cmd.getPromotion(), null));
    }

    @MessageMapping("/chess.resign")
    public void resign(SimpMessageHeaderAccessor sha) {
        syncHandler.onResign(sha.getSessionId());
    }

    @MessageMapping("/chess.offer-draw")
    public void offerDraw(SimpMessageHeaderAccessor sha) {
        syncHandler.onOfferDraw(sha.getSessionId());
    }

    @MessageMapping("/chess.accept-draw")
    public void acceptDraw(SimpMessageHeaderAccessor sha) {
        syncHandler.onAcceptDraw(sha.getSessionId());
    }

    @MessageMapping("/chess.decline-draw")
    public void declineDraw(SimpMessageHeaderAccessor sha) {
        syncHandler.onDeclineDraw(sha.getSessionId());
    }
}
