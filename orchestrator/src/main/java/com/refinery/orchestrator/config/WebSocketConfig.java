package com.refinery.orchestrator.config;

import com.refinery.orchestrator.stream.ProgressWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ProgressWebSocketHandler progressHandler;
    private final RefineryProperties       properties;

    public WebSocketConfig(ProgressWebSocketHandler progressHandler, RefineryProperties properties) {
        this.progressHandler = progressHandler;
        this.properties      = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(progressHandler, ProgressWebSocketHandler.PATH)
                .setAllowedOrigins(properties.stream().allowedOrigins());
    }
}
