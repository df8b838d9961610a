package com.example.rcaengine.analysis;

import com.example.rcaengine.EngineFixtures;
import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.correlation.WindowSnapshot;
import com.example.rcaengine.memory.BoundedLookup;
import com.example.rcaengine.memory.HistoricalOutcomeProvider;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.CandidateScore;
import com.example.rcaengine.model.CausalEdge;
import com.example.rcaengine.model.ContributingFactors;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.RootCauseHypothesis;
import com.example.rcaengine.topology.TopologySnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.rcaengine.EngineFixtures.T0;
import static com.example.rcaengine.EngineFixtures.alert;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RootCauseScorerTest {

    private static final ScoringWeights WEIGHTS = new ScoringWeights("v1", 0.30, 0.25, 0.25, 0.20);

    private EngineProperties properties;
    private HistoricalOutcomeProvider history;
    private ExecutorService lookupPool;
    private RootCauseScorer scorer;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        history = mock(HistoricalOutcomeProvider.class);
        lookupPool = Executors.newCachedThreadPool();
        scorer = new RootCauseScorer(properties, WEIGHTS, new CausalGraphBuilder(properties), history,
                new BoundedLookup(lookupPool));
    }

    @AfterEach
    void tearDown() {
        lookupPool.shutdownNow();
    }

    private static WindowSnapshot window(long revision, Alert... alerts) {
        List<Alert> members = List.of(alerts);
        Instant start = members.stream().map(Alert::getStartedAt).min(Comparator.naturalOrder()).orElseThrow();
        Instant end = members.stream().map(Alert::getStartedAt).max(Comparator.naturalOrder()).orElseThrow();
        LinkedHashSet<String> components = new LinkedHashSet<>();
        members.stream().filter(Alert::hasComponent).forEach(a -> components.add(a.getComponentId()));
        return new WindowSnapshot("INC-000001", 1, IncidentStatus.OPEN, start, end, members, components, revision);
    }

    private static WindowSnapshot cascade() {
        return window(3,
                alert("fp-db", "db-primary", T0),
                alert("fp-api", "api", T0.plusSeconds(30)),
                alert("fp-web", "web", T0.plusSeconds(57)));
    }

    @Test
    void earliestUpstreamComponentIsRootCause() {
        RootCauseHypothesis hypothesis = scorer.score(cascade(), EngineFixtures.chainTopology()).orElseThrow();

        assertEquals("db-primary", hypothesis.getComponentId());
        assertEquals(0.75, hypothesis.getConfidence(), 1e-9);
        assertFalse(hypothesis.isLowConfidence());
        assertFalse(hypothesis.isDegraded());
        assertEquals(3, hypothesis.getRevision());
        assertEquals(List.of(
                new CausalEdge("db-primary", "api", 30),
                new CausalEdge("api", "web", 27)), hypothesis.getCausalChain());

        ContributingFactors factors = hypothesis.getContributingFactors();
        assertEquals(1.0, factors.timeFactor());
        assertEquals(1.0, factors.dependencyFactor());
        assertEquals(0.0, factors.historicalFactor());
        assertEquals(1.0, factors.criticalityFactor());
        assertEquals("v1", factors.weightsVersion());
    }

    @Test
    void candidatesAreRankedByScore() {
        RootCauseHypothesis hypothesis = scorer.score(cascade(), EngineFixtures.chainTopology()).orElseThrow();

        List<String> order = hypothesis.getCandidates().stream().map(CandidateScore::componentId).toList();
        assertEquals(List.of("db-primary", "api", "web"), order);

        CandidateScore api = hypothesis.getCandidates().get(1);
        assertEquals(1, api.inDegree());
        assertFalse(api.isRootCandidate());
        assertEquals(0.473684, api.factors().timeFactor(), 1e-6);
        assertEquals(0.75, api.factors().dependencyFactor(), 1e-9);
        assertEquals(0.479605, api.score(), 1e-6);
        assertEquals(0.2875, hypothesis.getCandidates().get(2).score(), 1e-6);
    }

    @Test
    void historicalRateRaisesScore() {
        when(history.getRootCauseRate(eq("api"), anyString())).thenReturn(1.0);

        RootCauseHypothesis hypothesis = scorer.score(cascade(), EngineFixtures.chainTopology()).orElseThrow();

        CandidateScore api = hypothesis.getCandidates().stream()
                .filter(c -> c.componentId().equals("api")).findFirst().orElseThrow();
        assertEquals(1.0, api.factors().historicalFactor());
        assertEquals(0.729605, api.score(), 1e-6);
        assertEquals("db-primary", hypothesis.getComponentId());
    }

    @Test
    void historicalTimeoutRenormalizesRemainingWeights() {
        properties.getLookup().setHistoricalTimeoutMs(50);
        when(history.getRootCauseRate(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return 1.0;
        });

        RootCauseHypothesis hypothesis = scorer.score(cascade(), EngineFixtures.chainTopology()).orElseThrow();

        assertEquals("db-primary", hypothesis.getComponentId());
        assertTrue(hypothesis.isDegraded());
        ContributingFactors factors = hypothesis.getContributingFactors();
        assertTrue(factors.historicalDegraded());
        assertEquals(0.0, factors.historicalFactor());
        assertEquals(1.0, hypothesis.getConfidence(), 1e-6);

        CandidateScore web = hypothesis.getCandidates().get(2);
        assertEquals(0.383333, web.score(), 1e-6);
    }

    @Test
    void slowHistoryCostsOneTimeoutForTheWholeWindow() {
        properties.getLookup().setHistoricalTimeoutMs(200);
        when(history.getRootCauseRate(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return 1.0;
        });

        long started = System.nanoTime();
        RootCauseHypothesis hypothesis = scorer.score(cascade(), EngineFixtures.chainTopology()).orElseThrow();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertTrue(hypothesis.isDegraded());
        assertTrue(elapsedMs < 500, "three lookups waited " + elapsedMs + "ms");
    }

    @Test
    void weakTopScoreIsFlaggedNotWithheld() {
        properties.getScoring().setMinConfidence(0.9);

        RootCauseHypothesis hypothesis = scorer.score(cascade(), EngineFixtures.chainTopology()).orElseThrow();

        assertTrue(hypothesis.isLowConfidence());
        assertEquals("db-primary", hypothesis.getComponentId());
    }

    @Test
    void tiesBreakOnEarliestAlertThenId() {
        WindowSnapshot snapshot = window(2,
                alert("fp-2", "zeta", T0),
                alert("fp-1", "alpha", T0));

        RootCauseHypothesis hypothesis = scorer.score(snapshot, TopologySnapshot.empty()).orElseThrow();

        assertEquals("alpha", hypothesis.getComponentId());
        assertEquals(hypothesis.getCandidates().get(0).score(), hypothesis.getCandidates().get(1).score());
    }

    @Test
    void singleAlertWindowGetsNoHypothesis() {
        Optional<RootCauseHypothesis> hypothesis =
                scorer.score(window(1, alert("fp-db", "db-primary", T0)), EngineFixtures.chainTopology());

        assertTrue(hypothesis.isEmpty());
    }

    @Test
    void windowWithoutResolvedComponentsGetsNoHypothesis() {
        WindowSnapshot snapshot = window(2, alert("fp-1", null, T0), alert("fp-2", null, T0.plusSeconds(5)));

        assertTrue(scorer.score(snapshot, TopologySnapshot.empty()).isEmpty());
    }

    @Test
    void rescoringUnchangedWindowIsIdempotent() {
        WindowSnapshot snapshot = cascade();

        RootCauseHypothesis first = scorer.score(snapshot, EngineFixtures.chainTopology()).orElseThrow();
        RootCauseHypothesis second = scorer.score(snapshot, EngineFixtures.chainTopology()).orElseThrow();

        assertEquals(first, second);
    }

    @Test
    void timeFactorIsOneForZeroWidthWindow() {
        assertEquals(1.0, RootCauseScorer.timeFactor(T0, T0, T0));
        assertEquals(0.5, RootCauseScorer.timeFactor(T0.plusSeconds(30), T0, T0.plusSeconds(60)));
    }

    @Test
    void weightsMustSumToOne() {
        assertDoesNotThrow(WEIGHTS::validate);
        assertThrows(IllegalStateException.class, () -> new ScoringWeights("bad", 0.5, 0.5, 0.5, 0.0).validate());
        assertThrows(IllegalStateException.class, () -> new ScoringWeights("neg", 1.2, -0.2, 0.0, 0.0).validate());

        ScoringWeights renormalized = WEIGHTS.withoutHistorical();
        assertEquals(0.0, renormalized.historical());
        assertEquals(1.0, renormalized.time() + renormalized.dependency() + renormalized.criticality(), 1e-9);
        assertEquals(0.4, renormalized.time(), 1e-9);
    }
}
