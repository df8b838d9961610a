package com.example.rcaengine.analysis;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.correlation.WindowSnapshot;
import com.example.rcaengine.memory.BoundedLookup;
import com.example.rcaengine.memory.HistoricalOutcomeProvider;
import com.example.rcaengine.model.CandidateScore;
import com.example.rcaengine.model.CausalEdge;
import com.example.rcaengine.model.ContributingFactors;
import com.example.rcaengine.model.RootCauseHypothesis;
import com.example.rcaengine.topology.TopologySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Root-Cause Scorer - ranks the alerting components of a window.
 *
 * Score = weighted sum of four factors in [0,1]:
 * <ul>
 *   <li>time: 1.0 for the window start, linear down to 0 at the window end</li>
 *   <li>dependency: 1.0 without incoming causal edges, minus the decay per edge</li>
 *   <li>historical: confirmed root-cause rate for component and alert pattern</li>
 *   <li>criticality: tier score of the component</li>
 * </ul>
 * If any historical lookup degrades the factor is dropped for every
 * candidate and the remaining weights are re-normalized, so candidates of
 * one hypothesis are always scored with the same weights. All historical
 * lookups of a window run at once and share one deadline.
 *
 * Runs without any window lock; the hypothesis carries the revision of the
 * snapshot it was computed from.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RootCauseScorer {

    static final Comparator<CandidateScore> RANKING = Comparator
            .comparingDouble(CandidateScore::score).reversed()
            .thenComparing(CandidateScore::earliestAlertAt)
            .thenComparing(CandidateScore::componentId);

    private final EngineProperties properties;
    private final ScoringWeights weights;
    private final CausalGraphBuilder graphBuilder;
    private final HistoricalOutcomeProvider historicalOutcomes;
    private final BoundedLookup boundedLookup;

    /**
     * @return empty for windows with fewer than two alerts or without any
     *         firing alert on a known component
     */
    public Optional<RootCauseHypothesis> score(WindowSnapshot window, TopologySnapshot topology) {
        if (window.members().size() < 2) {
            return Optional.empty();
        }
        CausalGraph graph = graphBuilder.build(window.members(), topology);
        if (graph.isEmpty()) {
            return Optional.empty();
        }

        Map<String, BoundedLookup.PendingLookup<Double>> pending = new LinkedHashMap<>();
        for (CausalGraph.AlertingComponent component : graph.alerting().values()) {
            pending.put(component.componentId(), boundedLookup.start(
                    "historical rate " + component.componentId(),
                    () -> historicalOutcomes.getRootCauseRate(component.componentId(), component.alertPattern()),
                    0.0));
        }
        long deadline = BoundedLookup.deadlineAfter(properties.getLookup().getHistoricalTimeoutMs());
        Map<String, Double> historical = new LinkedHashMap<>();
        boolean historicalDegraded = false;
        for (Map.Entry<String, BoundedLookup.PendingLookup<Double>> entry : pending.entrySet()) {
            BoundedLookup.LookupResult<Double> rate = entry.getValue().await(deadline);
            historicalDegraded |= rate.degraded();
            historical.put(entry.getKey(), clamp(rate.value()));
        }

        ScoringWeights applied = historicalDegraded ? weights.withoutHistorical() : weights;
        double decay = properties.getScoring().getDependencyDecay();

        List<CandidateScore> candidates = new ArrayList<>();
        for (CausalGraph.AlertingComponent component : graph.alerting().values()) {
            int inDegree = graph.inDegree(component.componentId());
            ContributingFactors factors = new ContributingFactors(
                    round(timeFactor(component.earliestAlertAt(), window.windowStart(), window.windowEnd())),
                    round(Math.max(0.0, 1.0 - decay * inDegree)),
                    historicalDegraded ? 0.0 : round(historical.get(component.componentId())),
                    round(component.criticality().getScore()),
                    historicalDegraded,
                    applied.version());
            double score = round(applied.combine(factors.timeFactor(), factors.dependencyFactor(),
                    factors.historicalFactor(), factors.criticalityFactor()));
            candidates.add(new CandidateScore(component.componentId(), score, factors,
                    component.earliestAlertAt(), inDegree, component.alertPattern()));
        }
        candidates.sort(RANKING);

        CandidateScore top = candidates.get(0);
        double minConfidence = properties.getScoring().getMinConfidence();
        RootCauseHypothesis hypothesis = RootCauseHypothesis.builder()
                .componentId(top.componentId())
                .confidence(top.score())
                .lowConfidence(top.score() < minConfidence)
                .contributingFactors(top.factors())
                .causalChain(causalChain(graph, top.componentId()))
                .candidates(candidates)
                .revision(window.revision())
                .degraded(historicalDegraded)
                .build();

        log.debug("Window {} rev {}: root cause {} ({}{})", window.id(), window.revision(),
                top.componentId(), top.score(), hypothesis.isLowConfidence() ? ", low confidence" : "");
        return Optional.of(hypothesis);
    }

    static double timeFactor(Instant alertAt, Instant windowStart, Instant windowEnd) {
        long span = Duration.between(windowStart, windowEnd).toMillis();
        if (span <= 0) return 1.0;
        long remaining = Duration.between(alertAt, windowEnd).toMillis();
        return clamp((double) remaining / span);
    }

    /** Breadth-first walk from the root cause along causal edges, earliest effect first. */
    private List<CausalEdge> causalChain(CausalGraph graph, String root) {
        List<CausalEdge> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(root);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (CausalEdge edge : graph.outgoing(current)) {
                if (visited.add(edge.to())) {
                    chain.add(edge);
                    queue.add(edge.to());
                }
            }
        }
        return chain;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
