package org.chatrooms.config;

import org.chatrooms.controller.ChatSocketHandler;
import org.chatrooms.security.TokenHandshakeInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WsConfig implements WebSocketConfigurer {

    private final ChatSocketHandler chatSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;

    // same origins as CORS
    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    public WsConfig(ChatSocketHandler handler, TokenHandshakeInterceptor hs) {
        this.chatSocketHandler = handler;
        this.tokenHandshakeInterceptor = hs;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] patterns = allowedOrigins.split("\\s*,\\s*");
        registry.addHandler(chatSocketHandler, ChatSocketHandler.ENDPOINT)
                .addInterceptors(tokenHandshakeInterceptor)
                .setAllowedOriginPatterns(patterns);
    }
}
