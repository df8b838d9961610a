package com.example.rcaengine.service;

import com.example.rcaengine.analysis.InvestigationPathGenerator;
import com.example.rcaengine.analysis.RootCauseScorer;
import com.example.rcaengine.correlation.CorrelationResult;
import com.example.rcaengine.correlation.CorrelationWindow;
import com.example.rcaengine.correlation.CorrelationWindowManager;
import com.example.rcaengine.correlation.MatchStrategy;
import com.example.rcaengine.correlation.WindowSnapshot;
import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.lifecycle.IncidentLifecycleController;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.IncidentView;
import com.example.rcaengine.model.InvestigationPath;
import com.example.rcaengine.model.RawAlertEvent;
import com.example.rcaengine.model.RootCauseHypothesis;
import com.example.rcaengine.normalizer.AlertNormalizer;
import com.example.rcaengine.notification.IncidentStreamPublisher;
import com.example.rcaengine.topology.TopologyStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Correlation Engine - entry point of the alert pipeline:
 * normalize → correlate → score → lifecycle → incident stream.
 *
 * Normalization runs on the caller's thread; correlation and scoring run on
 * the ordering lane of the alert's component, so alerts for one component
 * are handled in arrival order. Scoring works on a window snapshot without
 * holding the window lock; a result computed against an outdated revision
 * is dropped by the lifecycle controller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationEngine {

    private final AlertNormalizer normalizer;
    private final CorrelationWindowManager windowManager;
    private final RootCauseScorer scorer;
    private final InvestigationPathGenerator pathGenerator;
    private final IncidentLifecycleController lifecycle;
    private final IncidentStreamPublisher publisher;
    private final TopologyStore topologyStore;
    private final AlertLaneDispatcher dispatcher;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;

    /**
     * Normalize on the calling thread and hand the alert to its lane.
     */
    public CompletableFuture<IngestResult> submit(RawAlertEvent event) {
        Alert alert = normalizer.normalize(event);
        return dispatcher.submit(laneKey(alert), () -> process(alert));
    }

    /**
     * Correlate one normalized alert. Must be called from the alert's lane
     * (or a single test thread) to keep per-component ordering.
     */
    public IngestResult process(Alert alert) {
        if (!alert.isFiring()) {
            return processResolved(alert);
        }

        CorrelationResult result = windowManager.correlate(alert);
        String incidentId = result.window().getId();
        countIngested(result.outcome());
        if (result.outcome() == CorrelationResult.Outcome.DUPLICATE) {
            log.debug("Duplicate alert {} ignored ({})", alert.getId(), incidentId);
            return IngestResult.of(alert, result);
        }

        publisher.publish(result.event());
        auditCorrelation(alert, result);
        // admitted already resolved when its resolved event came first
        if (alert.isFiring() || !lifecycle.closeIfAllResolved(incidentId)) {
            recompute(incidentId);
        }
        return IngestResult.of(alert, result);
    }

    private IngestResult processResolved(Alert alert) {
        Optional<CorrelationResult> resolved = windowManager.resolveAlert(alert.dedupKey(), alert.getId(),
                alert.getResolvedAt());
        if (resolved.isEmpty()) {
            log.debug("Resolved alert {} belongs to no incident, dropped", alert.getId());
            countIngested(CorrelationResult.Outcome.UNCHANGED);
            return new IngestResult(alert.getId(), null, CorrelationResult.Outcome.UNCHANGED, null);
        }

        CorrelationResult result = resolved.get();
        countIngested(result.outcome());
        if (result.outcome() == CorrelationResult.Outcome.MEMBER_RESOLVED) {
            String incidentId = result.window().getId();
            publisher.publish(result.event());
            if (!lifecycle.closeIfAllResolved(incidentId)) {
                recompute(incidentId);
            }
        }
        return IngestResult.of(alert, result);
    }

    /**
     * Score the window as it is now and hand the hypothesis to the lifecycle
     * controller, which keeps it only if the window did not change meanwhile.
     */
    public Optional<RootCauseHypothesis> recompute(String incidentId) {
        Optional<CorrelationWindow> window = windowManager.find(incidentId);
        if (window.isEmpty()) return Optional.empty();

        WindowSnapshot snapshot = window.get().snapshot();
        if (snapshot.status().isTerminal()) return Optional.empty();

        Timer.Sample sample = Timer.start(meterRegistry);
        Optional<RootCauseHypothesis> hypothesis = scorer.score(snapshot, topologyStore.current());
        boolean applied = hypothesis.map(h -> lifecycle.applyHypothesis(incidentId, h)).orElse(false);
        sample.stop(Timer.builder("rca.scoring.duration")
                .tag("result", hypothesis.isEmpty() ? "none" : applied ? "applied" : "stale")
                .register(meterRegistry));
        return hypothesis;
    }

    // ── queries ──

    public List<IncidentView> listIncidents(IncidentStatus status, boolean activeOnly) {
        return windowManager.all().stream()
                .filter(w -> status == null || w.getStatus() == status)
                .filter(w -> !activeOnly || !w.getStatus().isTerminal())
                .map(lifecycle::view)
                .toList();
    }

    public IncidentView getIncident(String incidentId) {
        return lifecycle.view(windowManager.require(incidentId));
    }

    public InvestigationPath investigationPath(String incidentId) {
        CorrelationWindow window = windowManager.require(incidentId);
        RootCauseHypothesis hypothesis = window.withLock(window::getRootCause);
        return pathGenerator.generate(incidentId, hypothesis);
    }

    // ── operator actions that change membership ──

    public IncidentView merge(String targetId, String sourceId, String actor) {
        IncidentView merged = lifecycle.merge(targetId, sourceId, actor);
        recompute(targetId);
        return getIncident(merged.getId());
    }

    public IncidentView reopen(String incidentId, String actor) {
        IncidentView reopened = lifecycle.reopen(incidentId, actor);
        recompute(reopened.getId());
        return getIncident(reopened.getId());
    }

    public Map<String, Object> stats() {
        List<CorrelationWindow> windows = windowManager.all();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("incidents", windows.size());
        stats.put("active_incidents", windows.stream().filter(w -> !w.getStatus().isTerminal()).count());
        stats.put("alerts", windowManager.alertCount());
        stats.put("pending_resolutions", windowManager.pendingResolutions());
        stats.put("lanes", dispatcher.getLaneCount());
        stats.put("topology_version", topologyStore.current().getVersion());
        return stats;
    }

    private void auditCorrelation(Alert alert, CorrelationResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alert", alert.getId());
        details.put("name", alert.getName());
        if (alert.hasComponent()) details.put("component", alert.getComponentId());
        if (result.outcome() == CorrelationResult.Outcome.OPENED) {
            auditService.log("system", AuditAction.WINDOW_OPENED, result.window().getId(), details);
        } else if (result.outcome() == CorrelationResult.Outcome.APPENDED) {
            details.put("strategy", result.strategy().name());
            auditService.log("system", AuditAction.ALERT_CORRELATED, result.window().getId(), details);
        }
    }

    private void countIngested(CorrelationResult.Outcome outcome) {
        Counter.builder("rca.alerts.ingested")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    static String laneKey(Alert alert) {
        return alert.hasComponent() ? alert.getComponentId() : alert.getFingerprint();
    }

    /**
     * What happened to one ingested alert.
     *
     * @param incidentId owning incident, null when the alert was dropped
     */
    public record IngestResult(String alertId, String incidentId, CorrelationResult.Outcome outcome,
                               MatchStrategy strategy) {

        static IngestResult of(Alert alert, CorrelationResult result) {
            return new IngestResult(alert.getId(), result.window().getId(), result.outcome(), result.strategy());
        }
    }
}
