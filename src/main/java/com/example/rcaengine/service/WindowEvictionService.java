package com.example.rcaengine.service;

import com.example.rcaengine.correlation.CorrelationWindowManager;
import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.model.IncidentEvent;
import com.example.rcaengine.notification.IncidentStreamPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Bounds the working set: closes open windows idle for longer than the
 * lookback as EXPIRED, then forgets resolved windows after the retention period.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WindowEvictionService {

    private final CorrelationWindowManager windowManager;
    private final IncidentStreamPublisher publisher;
    private final AuditService auditService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${rca-engine.eviction.interval-seconds:60}000")
    public void sweep() {
        Instant now = clock.instant();

        List<IncidentEvent> expired = windowManager.expireStale(now);
        for (IncidentEvent event : expired) {
            publisher.publish(event);
            auditService.log("system", AuditAction.WINDOW_EVICTED, event.getIncidentId(),
                    Map.of("reason", "EXPIRED", "alerts", event.getMemberAlertIds().size()));
        }

        List<String> purged = windowManager.purgeResolved(now);
        for (String incidentId : purged) {
            auditService.log("system", AuditAction.WINDOW_EVICTED, incidentId, Map.of("reason", "RETENTION"));
        }

        if (!expired.isEmpty() || !purged.isEmpty()) {
            log.info("Eviction sweep: {} expired, {} purged", expired.size(), purged.size());
        }
    }
}
