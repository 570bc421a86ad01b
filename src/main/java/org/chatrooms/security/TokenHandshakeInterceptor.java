// src/main/java/org/chatrooms/security/TokenHandshakeInterceptor.java
package org.chatrooms.security;

import org.chatrooms.controller.ChatSocketHandler;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriTemplate;

import java.util.Map;

/**
 * Copies the bearer token and the chatroom id of the handshake into the session attributes.
 * The handshake is never refused here: the connection lifecycle verifies the token once the
 * socket is open, so that a rejected client gets an explicit close code instead of an HTTP 401.
 */
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String TOKEN_ATTR = "token";
    public static final String CHATROOM_ATTR = "chatroomId";

    private final UriTemplate template = new UriTemplate(ChatSocketHandler.PATH_TEMPLATE);

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        // 1) Authorization header first, then ?token=
        String token = null;
        String auth = request.getHeaders().getFirst("Authorization");
        if (auth != null && auth.startsWith("Bearer ")) {
            token = auth.substring(7);
        }
        if (token == null) {
            token = UriComponentsBuilder.fromUri(request.getURI()).build()
                    .getQueryParams().getFirst("token");
        }
        if (token != null) {
            attributes.put(TOKEN_ATTR, token);
        }

        // 2) /api/v1/ws/chatrooms/{chatroomId}
        String path = request.getURI().getPath();
        if (path != null && template.matches(path)) {
            attributes.put(CHATROOM_ATTR, template.match(path).get("chatroomId"));
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               @Nullable Exception ex) {
    }
}
