package com.example.rcaengine.gateway;

import com.example.rcaengine.lifecycle.IncidentLifecycleController;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.RawAlertEvent;
import com.example.rcaengine.service.CorrelationEngine;
import com.example.rcaengine.topology.TopologyGraphView;
import com.example.rcaengine.topology.TopologyStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Registers the gateway RPC methods at application startup:
 * - gateway.* → gateway status
 * - alert.* → alert ingestion
 * - incident.* → incident queries and lifecycle
 * - topology.* → topology view
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayRpcRegistration {

    private final GatewayRpcRouter router;
    private final GatewayWebSocketHandler gatewayHandler;
    private final CorrelationEngine correlationEngine;
    private final IncidentLifecycleController lifecycle;
    private final TopologyStore topologyStore;
    private final ObjectMapper objectMapper;

    @EventListener(ApplicationReadyEvent.class)
    public void registerRpcMethods() {
        log.info("Registering Gateway RPC methods...");

        router.registerMethod("gateway.status", (params, session) -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("version", "0.1.0");
            status.put("sessions", gatewayHandler.getActiveSessionCount());
            status.put("engine", correlationEngine.stats());
            status.put("timestamp", Instant.now().toString());
            return status;
        });

        router.registerMethod("gateway.methods", (params, session) -> router.listMethods());

        router.registerMethod("alert.ingest", (params, session) -> {
            RawAlertEvent event = objectMapper.convertValue(params, RawAlertEvent.class);
            return correlationEngine.submit(event).join();
        });

        router.registerMethod("incident.list", (params, session) -> {
            Object status = params.get("status");
            IncidentStatus filter = status != null
                    ? IncidentStatus.valueOf(status.toString().toUpperCase(Locale.ROOT))
                    : null;
            boolean active = Boolean.parseBoolean(String.valueOf(params.getOrDefault("active", "false")));
            return correlationEngine.listIncidents(filter, active);
        });

        router.registerMethod("incident.get", (params, session) ->
                correlationEngine.getIncident(requireId(params)));

        router.registerMethod("incident.path", (params, session) ->
                correlationEngine.investigationPath(requireId(params)));

        router.registerMethod("incident.acknowledge", (params, session) ->
                lifecycle.acknowledge(requireId(params), actor(params, session)));

        router.registerMethod("incident.mitigate", (params, session) ->
                lifecycle.markMitigated(requireId(params), actor(params, session)));

        router.registerMethod("incident.close", (params, session) ->
                lifecycle.forceClose(requireId(params), actor(params, session)));

        router.registerMethod("topology.graph", (params, session) ->
                TopologyGraphView.of(topologyStore.current()));

        log.info("Registered {} RPC methods", router.getMethodCount());
    }

    private static String requireId(Map<String, Object> params) {
        Object id = params.get("id");
        if (id == null || id.toString().isBlank()) {
            throw new IllegalArgumentException("Missing param: id");
        }
        return id.toString();
    }

    private static String actor(Map<String, Object> params, GatewaySession session) {
        Object actor = params.get("actor");
        if (actor != null) return actor.toString();
        return session != null ? "gateway:" + session.getSessionId() : "gateway";
    }
}
