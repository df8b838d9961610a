package com.example.rcaengine.normalizer;

import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.AlertStatus;
import com.example.rcaengine.model.RawAlertEvent;
import com.example.rcaengine.model.Severity;
import com.example.rcaengine.topology.LabelMatchers;
import com.example.rcaengine.topology.TopologyNode;
import com.example.rcaengine.topology.TopologySnapshot;
import com.example.rcaengine.topology.TopologyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Alert Normalizer - turns an inbound alert event into the engine's canonical {@link Alert}.
 *
 * Component resolution policy, applied to every component whose label
 * matchers all match the alert labels:
 * 1. most specific matcher wins (greatest number of matched labels)
 * 2. then higher criticality (lower tier number)
 * 3. then lexicographically smallest component id
 * Alerts matching no component keep a null component and only take part in
 * temporal and label correlation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertNormalizer {

    static final Comparator<Candidate> RESOLUTION_ORDER = Comparator
            .comparingInt(Candidate::specificity).reversed()
            .thenComparingInt(c -> c.node().criticality().getTier())
            .thenComparing(c -> c.node().id());

    private final TopologyStore topologyStore;

    public Alert normalize(RawAlertEvent event) {
        return normalize(event, topologyStore.current());
    }

    public Alert normalize(RawAlertEvent event, TopologySnapshot topology) {
        if (event == null) {
            throw new IllegalArgumentException("Alert event is required");
        }
        Map<String, String> labels = event.getLabels() != null ? new HashMap<>(event.getLabels()) : new HashMap<>();

        String name = event.getName() != null && !event.getName().isBlank()
                ? event.getName()
                : labels.getOrDefault("alertname", "unknown");
        String severity = event.getSeverity() != null ? event.getSeverity() : labels.get("severity");
        Instant startedAt = event.getStartedAt();
        AlertStatus status = AlertStatus.parse(event.getStatus());

        String componentId = resolveComponent(labels, topology).orElse(null);
        if (componentId == null) {
            log.debug("Alert {} ({}) matched no component", event.getFingerprint(), name);
        }

        return Alert.builder()
                .fingerprint(event.getFingerprint())
                .name(name)
                .componentId(componentId)
                .severity(Severity.parse(severity))
                .startedAt(startedAt)
                .labels(labels)
                .status(status)
                .resolvedAt(status == AlertStatus.RESOLVED
                        ? (event.getEndsAt() != null ? event.getEndsAt() : startedAt)
                        : null)
                .build();
    }

    public Optional<String> resolveComponent(Map<String, String> labels, TopologySnapshot topology) {
        if (labels == null || labels.isEmpty() || topology.isEmpty()) {
            return Optional.empty();
        }
        return topology.nodes().stream()
                .map(node -> new Candidate(node, LabelMatchers.specificity(labels, node.labelMatchers())))
                .filter(c -> c.specificity() > 0)
                .min(RESOLUTION_ORDER)
                .map(c -> c.node().id());
    }

    record Candidate(TopologyNode node, int specificity) {
    }
}
