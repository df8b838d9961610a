package com.example.rcaengine.service;

import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.domain.AuditLog;
import com.example.rcaengine.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Audit trail for window and lifecycle actions. Writes are asynchronous so
 * that correlation never waits on the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Async("auditExecutor")
    public void log(String actor, AuditAction action, String target, Map<String, Object> details) {
        try {
            String detailsJson = details != null ? objectMapper.writeValueAsString(details) : null;
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(target)
                    .details(detailsJson)
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {}", actor, action, target);
        } catch (Exception e) {
            log.error("Failed to write audit log for {} {}: {}", action, target, e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, limit)).getContent();
    }

    public List<AuditLog> filter(String actor, AuditAction action, String target) {
        return auditLogRepository.findFiltered(actor, action, target);
    }

    public List<AuditLog> getForTarget(String target) {
        return auditLogRepository.findByTargetOrderByTimestampDesc(target);
    }

    public long countByAction(AuditAction action) {
        return auditLogRepository.countByAction(action);
    }
}
