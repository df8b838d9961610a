package com.example.rcaengine.normalizer;

import com.example.rcaengine.EngineFixtures;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.AlertStatus;
import com.example.rcaengine.model.RawAlertEvent;
import com.example.rcaengine.model.Severity;
import com.example.rcaengine.topology.Criticality;
import com.example.rcaengine.topology.TopologyNode;
import com.example.rcaengine.topology.TopologySnapshot;
import com.example.rcaengine.topology.TopologyStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertNormalizerTest {

    private final AlertNormalizer normalizer = new AlertNormalizer(new TopologyStore());

    private static RawAlertEvent event(Map<String, String> labels) {
        return RawAlertEvent.builder()
                .fingerprint("fp-1")
                .name("HighLatency")
                .labels(labels)
                .startedAt(EngineFixtures.T0)
                .build();
    }

    @Test
    void mostSpecificMatcherWins() {
        TopologySnapshot topology = TopologySnapshot.of(1, List.of(
                new TopologyNode("checkout", "checkout", "compute", Criticality.MEDIUM, Map.of("service", "checkout")),
                new TopologyNode("checkout-db", "checkout db", "database", Criticality.LOW,
                        Map.of("service", "checkout", "role", "db"))), List.of());

        Alert alert = normalizer.normalize(event(Map.of("service", "checkout", "role", "db")), topology);

        assertEquals("checkout-db", alert.getComponentId());
    }

    @Test
    void equalSpecificityFallsBackToCriticalityThenId() {
        TopologySnapshot topology = TopologySnapshot.of(1, List.of(
                new TopologyNode("pods", "pods", "compute", Criticality.LOW, Map.of("pod", "web-*")),
                new TopologyNode("web", "web", "compute", Criticality.HIGH, Map.of("pod", "web-1")),
                new TopologyNode("b-host", "b", "compute", Criticality.HIGH, Map.of("host", "h1")),
                new TopologyNode("a-host", "a", "compute", Criticality.HIGH, Map.of("host", "h1"))), List.of());

        assertEquals("web", normalizer.normalize(event(Map.of("pod", "web-1")), topology).getComponentId());
        assertEquals("a-host", normalizer.normalize(event(Map.of("host", "h1")), topology).getComponentId());
    }

    @Test
    void unmatchedAlertKeepsNullComponent() {
        Alert alert = normalizer.normalize(event(Map.of("service", "unknown")), EngineFixtures.chainTopology());

        assertNull(alert.getComponentId());
        assertFalse(alert.hasComponent());
        assertTrue(alert.isFiring());
    }

    @Test
    void nameAndSeverityFallBackToLabels() {
        RawAlertEvent raw = RawAlertEvent.builder()
                .fingerprint("fp-2")
                .labels(Map.of("alertname", "DiskFull", "severity", "critical"))
                .startedAt(EngineFixtures.T0)
                .build();

        Alert alert = normalizer.normalize(raw, TopologySnapshot.empty());

        assertEquals("DiskFull", alert.getName());
        assertEquals(Severity.CRITICAL, alert.getSeverity());
    }

    @Test
    void missingSeverityDefaultsToWarning() {
        Alert alert = normalizer.normalize(event(Map.of()), TopologySnapshot.empty());
        assertEquals(Severity.WARNING, alert.getSeverity());
    }

    @Test
    void resolvedEventCarriesResolutionTime() {
        RawAlertEvent raw = event(Map.of());
        raw.setStatus("resolved");
        raw.setEndsAt(EngineFixtures.T0.plusSeconds(90));

        Alert alert = normalizer.normalize(raw, TopologySnapshot.empty());

        assertEquals(AlertStatus.RESOLVED, alert.getStatus());
        assertEquals(EngineFixtures.T0.plusSeconds(90), alert.getResolvedAt());
    }

    @Test
    void idsAreDerivedFromFingerprintAndStart() {
        Alert first = normalizer.normalize(event(Map.of()), TopologySnapshot.empty());
        Alert again = normalizer.normalize(event(Map.of("extra", "label")), TopologySnapshot.empty());

        assertEquals(first.getId(), again.getId());
        assertEquals(first.dedupKey(), again.dedupKey());
        assertTrue(first.getId().startsWith("ALR-"));
    }

    @Test
    void missingFingerprintIsRejected() {
        RawAlertEvent raw = RawAlertEvent.builder().startedAt(EngineFixtures.T0).build();
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(raw, TopologySnapshot.empty()));
    }
}
