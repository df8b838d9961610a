package com.example.rcaengine.gateway;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * A connected gateway client: incident stream subscriber and RPC caller.
 */
@Data
@Builder
public class GatewaySession {

    private final String sessionId;
    private final WebSocketSession webSocketSession;
    private final Instant connectedAt;
    private Instant lastHeartbeat;

    public void updateHeartbeat() {
        this.lastHeartbeat = Instant.now();
    }

    public boolean isAlive() {
        return webSocketSession != null && webSocketSession.isOpen();
    }
}
