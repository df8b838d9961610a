package com.example.rcaengine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gateway WebSocket endpoint. Routes JSON-RPC requests and fans out the
 * incident stream to every connected session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final GatewayRpcRouter rpcRouter;

    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        GatewaySession gatewaySession = GatewaySession.builder()
                .sessionId(session.getId())
                .webSocketSession(session)
                .connectedAt(Instant.now())
                .lastHeartbeat(Instant.now())
                .build();

        sessions.put(session.getId(), gatewaySession);
        log.info("Gateway session connected: {} (total: {})", session.getId(), sessions.size());

        sendNotification(session, "gateway.connected", Map.of(
                "sessionId", session.getId(),
                "version", "0.1.0",
                "capabilities", Map.of(
                        "alerts", true,
                        "incidents", true,
                        "topology", true,
                        "stream", true
                )
        ));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonRpcMessage rpcMessage;
        try {
            rpcMessage = objectMapper.readValue(message.getPayload(), JsonRpcMessage.class);
        } catch (IOException e) {
            log.debug("Unparseable gateway message from {}: {}", session.getId(), e.getMessage());
            sendResponse(session, JsonRpcMessage.error(null, JsonRpcMessage.ErrorCode.PARSE_ERROR, "Parse error: " + e.getMessage()));
            return;
        }

        GatewaySession gatewaySession = sessions.get(session.getId());
        if (gatewaySession != null) {
            gatewaySession.updateHeartbeat();
        }

        if ("heartbeat".equals(rpcMessage.getMethod())) {
            sendResponse(session, JsonRpcMessage.success(rpcMessage.getId(), Map.of(
                    "status", "alive",
                    "timestamp", Instant.now().toString()
            )));
            return;
        }

        log.debug("RPC request: method={}, id={}", rpcMessage.getMethod(), rpcMessage.getId());
        JsonRpcMessage response = rpcRouter.route(rpcMessage, gatewaySession);
        if (rpcMessage.isNotification()) {
            return;
        }
        sendResponse(session, response);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Gateway session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Broadcast a notification to all connected sessions.
     */
    public void broadcast(String method, Object params) {
        String json;
        try {
            json = objectMapper.writeValueAsString(JsonRpcMessage.notification(method, params));
        } catch (IOException e) {
            log.error("Failed to serialize {} notification: {}", method, e.getMessage());
            return;
        }
        sessions.values().forEach(session -> {
            if (session.isAlive()) {
                send(session.getWebSocketSession(), json);
            }
        });
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    private void sendResponse(WebSocketSession session, JsonRpcMessage message) {
        try {
            send(session, objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            log.error("Failed to serialize response for session {}", session.getId(), e);
        }
    }

    private void sendNotification(WebSocketSession session, String method, Object params) {
        try {
            send(session, objectMapper.writeValueAsString(JsonRpcMessage.notification(method, params)));
        } catch (IOException e) {
            log.error("Failed to serialize notification for session {}", session.getId(), e);
        }
    }

    /** WebSocket sessions do not allow concurrent sends. */
    private void send(WebSocketSession session, String json) {
        synchronized (session) {
            try {
                session.sendMessage(new TextMessage(json));
            } catch (IOException e) {
                log.error("Failed to send to session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
