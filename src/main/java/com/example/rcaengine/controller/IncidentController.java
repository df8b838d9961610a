package com.example.rcaengine.controller;

import com.example.rcaengine.lifecycle.IncidentLifecycleController;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.IncidentView;
import com.example.rcaengine.model.InvestigationPath;
import com.example.rcaengine.service.CorrelationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Incident REST API Controller: queries, investigation paths and lifecycle actions.
 */
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
public class IncidentController {

    private final CorrelationEngine correlationEngine;
    private final IncidentLifecycleController lifecycle;

    @GetMapping
    public ResponseEntity<List<IncidentView>> listIncidents(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "false") boolean active) {
        IncidentStatus filter = status != null ? IncidentStatus.valueOf(status.toUpperCase(Locale.ROOT)) : null;
        return ResponseEntity.ok(correlationEngine.listIncidents(filter, active));
    }

    @GetMapping("/{id}")
    public ResponseEntity<IncidentView> getIncident(@PathVariable String id) {
        return ResponseEntity.ok(correlationEngine.getIncident(id));
    }

    @GetMapping("/{id}/investigation-path")
    public ResponseEntity<InvestigationPath> getInvestigationPath(@PathVariable String id) {
        return ResponseEntity.ok(correlationEngine.investigationPath(id));
    }

    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<IncidentView> acknowledge(@PathVariable String id,
                                                    @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(lifecycle.acknowledge(id, actor(body)));
    }

    @PostMapping("/{id}/mitigate")
    public ResponseEntity<IncidentView> mitigate(@PathVariable String id,
                                                 @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(lifecycle.markMitigated(id, actor(body)));
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<IncidentView> close(@PathVariable String id,
                                              @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(lifecycle.forceClose(id, actor(body)));
    }

    @PostMapping("/{id}/reopen")
    public ResponseEntity<IncidentView> reopen(@PathVariable String id,
                                               @RequestBody(required = false) Map<String, String> body) {
        return ResponseEntity.ok(correlationEngine.reopen(id, actor(body)));
    }

    /**
     * Merge another incident into this one: body {@code {"source_id": "..."}}.
     */
    @PostMapping("/{id}/merge")
    public ResponseEntity<IncidentView> merge(@PathVariable String id, @RequestBody Map<String, String> body) {
        String sourceId = body.get("source_id");
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("source_id is required");
        }
        return ResponseEntity.ok(correlationEngine.merge(id, sourceId, actor(body)));
    }

    /**
     * Body: {@code {"component_id": "...", "fix_reference": "..."}}; the fix reference is optional.
     */
    @PostMapping("/{id}/confirm-root-cause")
    public ResponseEntity<Map<String, String>> confirmRootCause(@PathVariable String id,
                                                                @RequestBody Map<String, String> body) {
        String componentId = body.get("component_id");
        lifecycle.confirmRootCause(id, componentId, body.get("fix_reference"), actor(body));
        return ResponseEntity.ok(Map.of("status", "confirmed", "incident_id", id, "component_id", componentId));
    }

    private static String actor(Map<String, String> body) {
        if (body == null) return "api";
        return body.getOrDefault("actor", "api");
    }
}
