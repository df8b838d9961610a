package com.example.rcaengine.service;

import com.example.rcaengine.EngineFixtures;
import com.example.rcaengine.analysis.CausalGraphBuilder;
import com.example.rcaengine.analysis.InvestigationPathGenerator;
import com.example.rcaengine.analysis.RootCauseScorer;
import com.example.rcaengine.analysis.ScoringWeights;
import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.correlation.CorrelationResult;
import com.example.rcaengine.correlation.CorrelationWindowManager;
import com.example.rcaengine.lifecycle.IncidentLifecycleController;
import com.example.rcaengine.memory.BoundedLookup;
import com.example.rcaengine.memory.DiagnosticContentProvider;
import com.example.rcaengine.memory.HistoricalOutcomeProvider;
import com.example.rcaengine.memory.RootCauseHistoryService;
import com.example.rcaengine.model.CausalEdge;
import com.example.rcaengine.model.CloseReason;
import com.example.rcaengine.model.IncidentEvent;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.IncidentView;
import com.example.rcaengine.model.InvestigationPath;
import com.example.rcaengine.model.RawAlertEvent;
import com.example.rcaengine.model.RootCauseHypothesis;
import com.example.rcaengine.normalizer.AlertNormalizer;
import com.example.rcaengine.notification.IncidentStreamPublisher;
import com.example.rcaengine.topology.TopologyStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.example.rcaengine.EngineFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CorrelationEngineTest {

    private AlertLaneDispatcher dispatcher;
    private IncidentStreamPublisher publisher;
    private IncidentLifecycleController lifecycle;
    private SimpleMeterRegistry meterRegistry;
    private CorrelationEngine engine;

    @BeforeEach
    void setUp() {
        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private CorrelationEngine newEngine() {
        EngineProperties properties = new EngineProperties();
        Clock clock = Clock.fixed(T0.plusSeconds(600), ZoneOffset.UTC);
        TopologyStore topologyStore = EngineFixtures.store(EngineFixtures.chainTopology());
        AuditService auditService = mock(AuditService.class);
        HistoricalOutcomeProvider history = mock(HistoricalOutcomeProvider.class);
        BoundedLookup boundedLookup = new BoundedLookup(Runnable::run);

        CorrelationWindowManager windowManager = new CorrelationWindowManager(properties, topologyStore,
                EngineFixtures.matchers(properties), clock, auditService);
        RootCauseScorer scorer = new RootCauseScorer(properties, new ScoringWeights("v1", 0.30, 0.25, 0.25, 0.20),
                new CausalGraphBuilder(properties), history, boundedLookup);
        InvestigationPathGenerator pathGenerator = new InvestigationPathGenerator(properties,
                mock(DiagnosticContentProvider.class), history, boundedLookup);
        publisher = mock(IncidentStreamPublisher.class);
        lifecycle = new IncidentLifecycleController(windowManager, publisher,
                auditService, mock(RootCauseHistoryService.class), clock);
        dispatcher = new AlertLaneDispatcher(properties);
        meterRegistry = new SimpleMeterRegistry();
        return new CorrelationEngine(new AlertNormalizer(topologyStore), windowManager, scorer, pathGenerator,
                lifecycle, publisher, topologyStore, dispatcher, auditService, meterRegistry);
    }

    private static RawAlertEvent firing(String fingerprint, String name, Instant startedAt, Map<String, String> labels) {
        return RawAlertEvent.builder()
                .fingerprint(fingerprint)
                .name(name)
                .labels(labels)
                .startedAt(startedAt)
                .status("firing")
                .build();
    }

    private static RawAlertEvent resolved(RawAlertEvent firing, Instant endsAt) {
        return RawAlertEvent.builder()
                .fingerprint(firing.getFingerprint())
                .name(firing.getName())
                .labels(firing.getLabels())
                .startedAt(firing.getStartedAt())
                .endsAt(endsAt)
                .status("resolved")
                .build();
    }

    private static List<RawAlertEvent> cascade() {
        return List.of(
                firing("fp-db", "DbConnectionsExhausted", T0, Map.of("service", "db", "role", "primary")),
                firing("fp-api", "ApiLatencyHigh", T0.plusSeconds(30), Map.of("service", "api")),
                firing("fp-web", "WebErrorRate", T0.plusSeconds(57), Map.of("service", "web")));
    }

    private List<CorrelationEngine.IngestResult> ingest(List<RawAlertEvent> events) {
        List<CorrelationEngine.IngestResult> results = new ArrayList<>();
        events.forEach(event -> results.add(engine.submit(event).join()));
        return results;
    }

    @Test
    void singleAlertOpensIncidentWithoutHypothesis() {
        CorrelationEngine.IngestResult result = engine.submit(
                firing("fp-db", "DbConnectionsExhausted", T0, Map.of("service", "db", "role", "primary"))).join();

        assertEquals(CorrelationResult.Outcome.OPENED, result.outcome());
        IncidentView incident = engine.getIncident(result.incidentId());
        assertEquals(IncidentStatus.OPEN, incident.getStatus());
        assertNull(incident.getRootCause());
        assertEquals(List.of("db-primary"), incident.getAffectedComponents());
        verify(publisher).publish(any(IncidentEvent.class));
    }

    @Test
    void cascadeIsOneIncidentRootedAtDatabase() {
        List<CorrelationEngine.IngestResult> results = ingest(cascade());

        String incidentId = results.get(0).incidentId();
        results.forEach(r -> assertEquals(incidentId, r.incidentId()));
        assertEquals(CorrelationResult.Outcome.APPENDED, results.get(2).outcome());

        IncidentView incident = engine.getIncident(incidentId);
        assertEquals(3, incident.getAlerts().size());
        RootCauseHypothesis rootCause = incident.getRootCause();
        assertNotNull(rootCause);
        assertEquals("db-primary", rootCause.getComponentId());
        assertEquals(incident.getRevision(), rootCause.getRevision());
        assertEquals(List.of(
                new CausalEdge("db-primary", "api", 30),
                new CausalEdge("api", "web", 27)), rootCause.getCausalChain());
    }

    @Test
    void investigationPathStartsAtRootCause() {
        String incidentId = ingest(cascade()).get(0).incidentId();

        InvestigationPath path = engine.investigationPath(incidentId);

        assertEquals(3, path.steps().size());
        assertEquals("db-primary", path.steps().get(0).componentId());
        double total = path.steps().stream().mapToDouble(s -> s.probability()).sum();
        assertEquals(1.0, total, 1e-5);
    }

    @Test
    void unmatchedAlertOpensIsolatedIncident() {
        String cascadeIncident = ingest(cascade()).get(0).incidentId();

        CorrelationEngine.IngestResult stray = engine.submit(firing("fp-batch", "BatchJobFailed",
                T0.plusSeconds(900), Map.of("job", "nightly-report"))).join();

        assertEquals(CorrelationResult.Outcome.OPENED, stray.outcome());
        assertNotEquals(cascadeIncident, stray.incidentId());
        assertTrue(engine.getIncident(stray.incidentId()).getAffectedComponents().isEmpty());
    }

    @Test
    void duplicateAlertIsNotPublishedAgain() {
        RawAlertEvent event = firing("fp-db", "DbConnectionsExhausted", T0, Map.of("service", "db", "role", "primary"));
        engine.submit(event).join();

        CorrelationEngine.IngestResult again = engine.submit(event).join();

        assertEquals(CorrelationResult.Outcome.DUPLICATE, again.outcome());
        verify(publisher, times(1)).publish(any(IncidentEvent.class));
        assertEquals(1.0, meterRegistry.counter("rca.alerts.ingested", "outcome", "duplicate").count());
    }

    @Test
    void allAlertsResolvedClosesInvestigatedIncident() {
        RawAlertEvent db = firing("fp-db", "DbConnectionsExhausted", T0, Map.of("service", "db", "role", "primary"));
        String incidentId = engine.submit(db).join().incidentId();
        lifecycle.acknowledge(incidentId, "oncall");

        CorrelationEngine.IngestResult result = engine.submit(resolved(db, T0.plusSeconds(300))).join();

        assertEquals(CorrelationResult.Outcome.MEMBER_RESOLVED, result.outcome());
        IncidentView incident = engine.getIncident(incidentId);
        assertEquals(IncidentStatus.RESOLVED, incident.getStatus());
        assertEquals(CloseReason.ALERTS_RESOLVED, incident.getCloseReason());
    }

    @Test
    void resolvedAlertForUnknownIncidentIsDropped() {
        RawAlertEvent ghost = firing("fp-ghost", "Ghost", T0, Map.of());

        CorrelationEngine.IngestResult result = engine.submit(resolved(ghost, T0.plusSeconds(10))).join();

        assertNull(result.incidentId());
        assertEquals(CorrelationResult.Outcome.UNCHANGED, result.outcome());
        assertTrue(engine.listIncidents(null, false).isEmpty());
        verify(publisher, never()).publish(any());
    }

    @Test
    void resolvedEventAheadOfFiringClosesIncidentOnArrival() {
        RawAlertEvent db = firing("fp-db", "DbConnectionsExhausted", T0, Map.of("service", "db", "role", "primary"));

        CorrelationEngine.IngestResult early = engine.submit(resolved(db, T0.plusSeconds(60))).join();
        assertNull(early.incidentId());
        assertEquals(1L, engine.stats().get("pending_resolutions"));

        CorrelationEngine.IngestResult late = engine.submit(db).join();

        assertEquals(CorrelationResult.Outcome.OPENED, late.outcome());
        IncidentView incident = engine.getIncident(late.incidentId());
        assertEquals(IncidentStatus.RESOLVED, incident.getStatus());
        assertEquals(CloseReason.ALERTS_RESOLVED, incident.getCloseReason());
        assertFalse(incident.getAlerts().get(0).isFiring());
        assertEquals(T0.plusSeconds(60), incident.getAlerts().get(0).getResolvedAt());
        assertEquals(0L, engine.stats().get("pending_resolutions"));
    }

    @Test
    void lateFiringOfResolvedMemberKeepsIncidentOpenWhileOthersFire() {
        List<RawAlertEvent> cascade = cascade();
        engine.submit(resolved(cascade.get(1), T0.plusSeconds(90))).join();

        List<CorrelationEngine.IngestResult> results = ingest(cascade);

        String incidentId = results.get(0).incidentId();
        assertEquals(incidentId, results.get(1).incidentId());
        IncidentView incident = engine.getIncident(incidentId);
        assertEquals(IncidentStatus.OPEN, incident.getStatus());
        assertEquals(1, incident.getAlerts().stream().filter(alert -> !alert.isFiring()).count());
    }

    @Test
    void replayingSameAlertsGivesSameHypothesis() {
        String first = ingest(cascade()).get(0).incidentId();
        RootCauseHypothesis expected = engine.getIncident(first).getRootCause();
        dispatcher.shutdown();

        engine = newEngine();
        String second = ingest(cascade()).get(0).incidentId();

        assertEquals(first, second);
        assertEquals(expected, engine.getIncident(second).getRootCause());
    }

    @Test
    void alertsOfOneComponentAreCorrelatedInArrivalOrder() {
        List<CompletableFuture<CorrelationEngine.IngestResult>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(engine.submit(firing("fp-db-" + i, "DbReplicaLag", T0.plusSeconds(i * 10L),
                    Map.of("service", "db", "role", "primary"))));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertEquals(CorrelationResult.Outcome.OPENED, futures.get(0).join().outcome());
        futures.subList(1, 5).forEach(f -> assertEquals(CorrelationResult.Outcome.APPENDED, f.join().outcome()));
        List<IncidentView> incidents = engine.listIncidents(null, true);
        assertEquals(1, incidents.size());
        assertEquals(5, incidents.get(0).getAlerts().size());
        assertTrue(incidents.get(0).isStorm());
    }

    @Test
    void statsReportWindowsAndAlerts() {
        ingest(cascade());

        Map<String, Object> stats = engine.stats();

        assertEquals(1, stats.get("incidents"));
        assertEquals(1L, stats.get("active_incidents"));
        assertEquals(3, stats.get("alerts"));
        assertEquals(8, stats.get("lanes"));
        assertEquals(2, meterRegistry.find("rca.scoring.duration").tag("result", "applied").timer().count());
    }
}
