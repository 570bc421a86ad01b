package org.chatrooms.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.chatrooms.security.TokenHandshakeInterceptor;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;
import org.chatrooms.service.realtime.lifecycle.ConnectionLifecycle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * /api/v1/ws/chatrooms/{chatroomId}
 * - connection established: authenticate + admit through the lifecycle
 * - text frame: ingest (persist, then broadcast to the room)
 * - closed / transport error: deregister
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatSocketHandler extends TextWebSocketHandler {

    public static final String PATH_TEMPLATE = "/api/v1/ws/chatrooms/{chatroomId}";
    public static final String ENDPOINT = "/api/v1/ws/chatrooms/*";

    static final String CONNECTION_ATTR = "chat.connection";

    private final ConnectionLifecycle lifecycle;

    @Value("${chat.ws.max-frame-bytes:65536}")
    private int maxFrameBytes = 65536;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.setTextMessageSizeLimit(maxFrameBytes);
        String token = (String) session.getAttributes().get(TokenHandshakeInterceptor.TOKEN_ATTR);
        String chatroomId = (String) session.getAttributes().get(TokenHandshakeInterceptor.CHATROOM_ATTR);
        lifecycle.open(session, token, chatroomId)
                .ifPresent(c -> session.getAttributes().put(CONNECTION_ATTR, c));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ChatConnection connection = connectionOf(session);
        if (connection != null) {
            lifecycle.onText(connection, message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ChatConnection connection = connectionOf(session);
        if (connection != null) {
            lifecycle.onBinary(connection);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ChatConnection connection = connectionOf(session);
        if (connection != null) {
            lifecycle.onTransportError(connection, exception);
        } else {
            log.debug("[TRANSPORT] session={} error before admission: {}", session.getId(), exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ChatConnection connection = connectionOf(session);
        if (connection != null) {
            lifecycle.onPeerClosed(connection, status);
        }
    }

    private ChatConnection connectionOf(WebSocketSession session) {
        Object c = session.getAttributes().get(CONNECTION_ATTR);
        return (c instanceof ChatConnection conn) ? conn : null;
    }
}
