package com.chesshub.chessservice.platform.ws;

import com.chesshub.chessservice.platform.transport.BroadcastEvent;
import com.chesshub.chessservice.platform.transport.RoomBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 STOMP 的下行推送
 * ----------------------------------------
 *   - 房间广播：/topic/room.{roomId}
 *   - 定向推送：/user/queue/chess（按 STOMP 会话ID 寻址，不依赖登录用户）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompRoomBroadcaster implements RoomBroadcaster {

    /** 定向消息的目标队列（客户端订阅 /user/queue/chess） */
    static final String USER_QUEUE = "/queue/chess";

    private final SimpMessagingTemplate messaging;

    @Override
    public void toRoom(String roomId, String type, Object payload) {
        messaging.convertAndSend(topic(roomId), new BroadcastEvent(roomId, type, payload));
    }

    @Override
    public void toSocket(String socketId, String roomId, String type, Object payload) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(socketId);
        headerAccessor.setLeaveMutable(true);
        // user 与 sessionId 相同时，UserDestinationResolver 直接投递到该会话
        messaging.convertAndSendToUser(socketId, USER_QUEUE,
                new BroadcastEvent(roomId, type, payload), headerAccessor.getMessageHeaders());
    }

    static String topic(String roomId) {
        return "/topic/room." + roomId;
    }
}
