package com.chesshub.chessservice.platform.ws;

import com.chesshub.chessservice.games.chess.application.ChessSyncHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * 监听 STOMP 连接/断开事件，把断开转交给协议处理器（启动掉线宽限计时、通知对手）。
 *
 * 断开事件基于底层连接关闭，覆盖关闭页签、强杀浏览器、网络中断等所有情况。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final ChessSyncHandler syncHandler;

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        String sessionId = StompHeaderAccessor.wrap(event.getMessage()).getSessionId();
        log.debug("【WebSocket连接】sessionId={}", sessionId);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("【WebSocket断开检测】收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        log.info("【WebSocket断开检测】sessionId={}, closeStatus={}", sessionId, event.getCloseStatus());
        syncHandler.onDisconnect(sessionId);
    }
}
