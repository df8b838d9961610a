package com.example.rcaengine.lifecycle;

import com.example.rcaengine.correlation.CorrelationWindow;
import com.example.rcaengine.correlation.CorrelationWindowManager;
import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.memory.RootCauseHistoryService;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.CloseReason;
import com.example.rcaengine.model.IncidentEvent;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.IncidentView;
import com.example.rcaengine.model.RootCauseHypothesis;
import com.example.rcaengine.notification.IncidentStreamPublisher;
import com.example.rcaengine.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Incident Lifecycle Controller - drives incidents through
 * open → investigating → identified → mitigated → resolved.
 *
 * External signals: acknowledge, mitigate, force-close, merge, reopen and
 * root-cause confirmation. Internal signals: an applied hypothesis
 * (investigating → identified when confident) and all members resolved
 * (any non-terminal state → resolved). Every change is published on the
 * incident stream after the window lock is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentLifecycleController {

    private final CorrelationWindowManager windowManager;
    private final IncidentStreamPublisher publisher;
    private final AuditService auditService;
    private final RootCauseHistoryService historyService;
    private final Clock clock;

    /**
     * First acknowledgment moves an open incident to investigating. Repeated
     * acknowledgments of an incident already under investigation are no-ops.
     */
    public IncidentView acknowledge(String incidentId, String actor) {
        CorrelationWindow window = windowManager.require(incidentId);
        Transition transition = window.withLock(() -> {
            IncidentStatus from = window.getStatus();
            if (from.isTerminal()) {
                throw new IllegalStateTransitionException(incidentId, from, IncidentStatus.INVESTIGATING);
            }
            if (from == IncidentStatus.OPEN) {
                window.transitionTo(IncidentStatus.INVESTIGATING, clock.instant());
            }
            promoteIfIdentified(window);
            return Transition.of(window, from);
        });
        return finish(transition, actor, "acknowledge");
    }

    public IncidentView markMitigated(String incidentId, String actor) {
        CorrelationWindow window = windowManager.require(incidentId);
        Transition transition = window.withLock(() -> {
            IncidentStatus from = window.getStatus();
            window.transitionTo(IncidentStatus.MITIGATED, clock.instant());
            return Transition.of(window, from);
        });
        return finish(transition, actor, "mitigate");
    }

    public IncidentView forceClose(String incidentId, String actor) {
        CorrelationWindow window = windowManager.require(incidentId);
        Transition transition = window.withLock(() -> {
            IncidentStatus from = window.getStatus();
            window.close(CloseReason.FORCE_CLOSED, clock.instant());
            return Transition.of(window, from);
        });
        return finish(transition, actor, "force-close");
    }

    /**
     * Install a freshly computed hypothesis unless the window moved on
     * while it was being computed.
     *
     * @return false when the hypothesis was stale and discarded
     */
    public boolean applyHypothesis(String incidentId, RootCauseHypothesis hypothesis) {
        CorrelationWindow window = windowManager.find(incidentId).orElse(null);
        if (window == null) return false;

        Transition transition = window.withLock(() -> {
            IncidentStatus from = window.getStatus();
            if (!window.applyHypothesis(hypothesis)) {
                return null;
            }
            promoteIfIdentified(window);
            return Transition.of(window, from);
        });
        if (transition == null) {
            log.debug("Discarded stale hypothesis rev {} for {}", hypothesis.getRevision(), incidentId);
            return false;
        }
        finish(transition, "system", "hypothesis");
        return true;
    }

    /**
     * Resolve the incident once every member alert has resolved.
     *
     * @return true when the incident was closed by this call
     */
    public boolean closeIfAllResolved(String incidentId) {
        CorrelationWindow window = windowManager.find(incidentId).orElse(null);
        if (window == null) return false;

        Transition transition = window.withLock(() -> {
            IncidentStatus from = window.getStatus();
            if (from.isTerminal() || !window.allMembersResolved()) {
                return null;
            }
            window.close(CloseReason.ALERTS_RESOLVED, clock.instant());
            return Transition.of(window, from);
        });
        if (transition == null) return false;
        finish(transition, "system", "alerts-resolved");
        return true;
    }

    public IncidentView merge(String targetId, String sourceId, String actor) {
        CorrelationWindowManager.MergeResult result = windowManager.merge(targetId, sourceId);
        publisher.publish(result.sourceEvent());
        publisher.publish(result.targetEvent());
        auditService.log(actor, AuditAction.WINDOWS_MERGED, targetId,
                Map.of("source", sourceId, "moved_alerts", result.movedAlerts()));
        return view(result.target());
    }

    public IncidentView reopen(String incidentId, String actor) {
        CorrelationWindowManager.ReopenResult result = windowManager.reopen(incidentId);
        publisher.publish(result.previousEvent());
        publisher.publish(result.event());
        auditService.log(actor, AuditAction.INCIDENT_TRANSITION, result.window().getId(),
                Map.of("operation", "reopen", "reopened_from", incidentId, "to", IncidentStatus.OPEN.name()));
        return view(result.window());
    }

    /**
     * Record which component actually caused a resolved incident. Feeds the
     * historical factor of future scoring; allowed once per incident.
     */
    public void confirmRootCause(String incidentId, String componentId, String fixReference, String actor) {
        if (componentId == null || componentId.isBlank()) {
            throw new IllegalArgumentException("component_id is required");
        }
        CorrelationWindow window = windowManager.require(incidentId);
        Map<String, String> patterns = window.withLock(() -> {
            if (!window.getStatus().isTerminal()) {
                throw new IllegalStateTransitionException(incidentId,
                        "Root cause can only be confirmed on a resolved incident, " + incidentId + " is "
                                + window.getStatus());
            }
            return patternsByComponent(window);
        });
        if (historyService.hasOutcome(incidentId)) {
            throw new IllegalStateTransitionException(incidentId, "Root cause of " + incidentId + " already confirmed");
        }

        historyService.recordOutcome(incidentId, patterns, componentId, fixReference);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("component", componentId);
        if (fixReference != null) details.put("fix_reference", fixReference);
        auditService.log(actor, AuditAction.ROOT_CAUSE_CONFIRMED, incidentId, details);
    }

    public IncidentView view(CorrelationWindow window) {
        return window.withLock(window::toView);
    }

    private void promoteIfIdentified(CorrelationWindow window) {
        RootCauseHypothesis rootCause = window.getRootCause();
        if (window.getStatus() == IncidentStatus.INVESTIGATING && rootCause != null && !rootCause.isLowConfidence()) {
            window.transitionTo(IncidentStatus.IDENTIFIED, clock.instant());
            log.info("Incident {} identified: root cause {} ({})", window.getId(),
                    rootCause.getComponentId(), rootCause.getConfidence());
        }
    }

    /** Alert pattern of the earliest alert per component. */
    private static Map<String, String> patternsByComponent(CorrelationWindow window) {
        Map<String, String> patterns = new TreeMap<>();
        window.members().stream()
                .filter(Alert::hasComponent)
                .sorted(Comparator.comparing(Alert::getStartedAt).thenComparing(Alert::getId))
                .forEach(alert -> patterns.putIfAbsent(alert.getComponentId(), alert.alertPattern()));
        return patterns;
    }

    private IncidentView finish(Transition transition, String actor, String operation) {
        publisher.publish(transition.event());
        if (transition.from() != transition.to()) {
            log.info("Incident {} {} -> {} ({})", transition.view().getId(), transition.from(), transition.to(), operation);
            auditService.log(actor, AuditAction.INCIDENT_TRANSITION, transition.view().getId(),
                    Map.of("operation", operation, "from", transition.from().name(), "to", transition.to().name()));
        }
        return transition.view();
    }

    private record Transition(IncidentStatus from, IncidentStatus to, IncidentEvent event, IncidentView view) {

        static Transition of(CorrelationWindow window, IncidentStatus from) {
            return new Transition(from, window.getStatus(), window.toEvent(), window.toView());
        }
    }
}
