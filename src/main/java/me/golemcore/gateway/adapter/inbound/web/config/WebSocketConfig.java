package me.golemcore.gateway.adapter.inbound.web.config;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.GatewayWebSocketHandler;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * WebFlux WebSocket configuration for the gateway event endpoint.
 */
@Configuration
@RequiredArgsConstructor
public class WebSocketConfig {

    private final GatewayWebSocketHandler gatewayWebSocketHandler;
    private final GatewayProperties properties;

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping();
        mapping.setUrlMap(Map.of(properties.getWebsocket().getPath(), gatewayWebSocketHandler));
        mapping.setOrder(-1);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
