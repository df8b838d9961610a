package com.example.rcaengine.config;

import com.example.rcaengine.gateway.GatewayWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the gateway handler at {@code rca-engine.gateway.path}. Operators
 * and downstream consumers subscribe to the incident stream there and call
 * the engine's RPC methods over the same connection.
 */
@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final GatewayWebSocketHandler gatewayHandler;
    private final EngineProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        EngineProperties.GatewayConfig gateway = properties.getGateway();
        registry.addHandler(gatewayHandler, gateway.getPath())
                .setAllowedOrigins(gateway.getAllowedOrigins().toArray(String[]::new));
        log.info("Gateway endpoint {} (origins {})", gateway.getPath(), gateway.getAllowedOrigins());
    }
}
