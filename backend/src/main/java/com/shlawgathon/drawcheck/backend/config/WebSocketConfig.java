package com.shlawgathon.drawcheck.backend.config;

import com.shlawgathon.drawcheck.backend.websocket.ValidationProgressWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ValidationProgressWebSocketHandler progressHandler;

    @Value("${drawcheck.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(ValidationProgressWebSocketHandler progressHandler) {
        this.progressHandler = progressHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(progressHandler, "/ws/validations/{requestId}")
                .setAllowedOrigins(allowedOrigins);
    }
}
