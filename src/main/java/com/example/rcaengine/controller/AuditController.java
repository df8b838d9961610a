package com.example.rcaengine.controller;

import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.domain.AuditLog;
import com.example.rcaengine.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Audit Trail REST API Controller.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLogs(
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) AuditAction action,
            @RequestParam(required = false) String target,
            @RequestParam(defaultValue = "100") int limit) {
        if (actor == null && action == null && target == null) {
            return ResponseEntity.ok(auditService.getRecent(limit));
        }
        return ResponseEntity.ok(auditService.filter(actor, action, target));
    }

    @GetMapping("/incident/{incidentId}")
    public ResponseEntity<List<AuditLog>> getForIncident(@PathVariable String incidentId) {
        return ResponseEntity.ok(auditService.getForTarget(incidentId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "windows_opened", auditService.countByAction(AuditAction.WINDOW_OPENED),
                "alerts_correlated", auditService.countByAction(AuditAction.ALERT_CORRELATED),
                "windows_merged", auditService.countByAction(AuditAction.WINDOWS_MERGED),
                "windows_evicted", auditService.countByAction(AuditAction.WINDOW_EVICTED),
                "windows_recreated", auditService.countByAction(AuditAction.WINDOW_RECREATED),
                "root_causes_confirmed", auditService.countByAction(AuditAction.ROOT_CAUSE_CONFIRMED)
        ));
    }
}
