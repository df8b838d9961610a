package com.example.rcaengine.gateway;

import com.example.rcaengine.correlation.IncidentNotFoundException;
import com.example.rcaengine.gateway.JsonRpcMessage.ErrorCode;
import com.example.rcaengine.lifecycle.IllegalStateTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Routes JSON-RPC method calls to their handlers, by domain:
 * - gateway.* → gateway status
 * - alert.* → alert ingestion
 * - incident.* → incident queries and lifecycle
 * - topology.* → topology view
 *
 * Bad input, unknown incidents and refused transitions are invalid params;
 * anything else is an internal error.
 */
@Slf4j
@Component
public class GatewayRpcRouter {

    private final Map<String, BiFunction<Map<String, Object>, GatewaySession, Object>> handlers =
            new ConcurrentHashMap<>();

    public void registerMethod(String method, BiFunction<Map<String, Object>, GatewaySession, Object> handler) {
        handlers.put(method, handler);
        log.debug("Registered RPC method: {}", method);
    }

    public JsonRpcMessage route(JsonRpcMessage request, GatewaySession session) {
        String method = request.getMethod();
        if (method == null) {
            return JsonRpcMessage.error(request.getId(), ErrorCode.INVALID_REQUEST, "Invalid request: missing method");
        }

        BiFunction<Map<String, Object>, GatewaySession, Object> handler = handlers.get(method);
        if (handler == null) {
            return JsonRpcMessage.error(request.getId(), ErrorCode.METHOD_NOT_FOUND, "Method not found: " + method);
        }

        Map<String, Object> params;
        try {
            params = asParams(request.getParams());
        } catch (IllegalArgumentException e) {
            return JsonRpcMessage.error(request.getId(), ErrorCode.INVALID_PARAMS, e.getMessage());
        }

        try {
            Object result = handler.apply(params, session);
            return JsonRpcMessage.success(request.getId(), result);
        } catch (IncidentNotFoundException e) {
            log.debug("RPC method {} rejected: {}", method, e.getMessage());
            return JsonRpcMessage.error(request.getId(), ErrorCode.INVALID_PARAMS, e.getMessage(),
                    rejection("not_found", e.getIncidentId()));
        } catch (IllegalStateTransitionException e) {
            log.debug("RPC method {} rejected: {}", method, e.getMessage());
            return JsonRpcMessage.error(request.getId(), ErrorCode.INVALID_PARAMS, e.getMessage(),
                    rejection("illegal_transition", e.getIncidentId()));
        } catch (IllegalArgumentException e) {
            log.debug("RPC method {} rejected: {}", method, e.getMessage());
            return JsonRpcMessage.error(request.getId(), ErrorCode.INVALID_PARAMS, e.getMessage());
        } catch (Exception e) {
            log.error("Error executing RPC method {}: {}", method, e.getMessage(), e);
            return JsonRpcMessage.error(request.getId(), ErrorCode.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    private static Map<String, Object> rejection(String reason, String incidentId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason);
        if (incidentId != null) data.put("incident", incidentId);
        return data;
    }

    /** Registered method names, sorted. */
    public Map<String, String> listMethods() {
        Map<String, String> methodList = new TreeMap<>();
        handlers.keySet().forEach(method -> methodList.put(method, "registered"));
        return methodList;
    }

    public int getMethodCount() {
        return handlers.size();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asParams(Object params) {
        if (params == null) return Map.of();
        if (params instanceof Map<?, ?> map) return (Map<String, Object>) map;
        throw new IllegalArgumentException("Params must be a JSON object");
    }
}
