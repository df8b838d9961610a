package com.example.rcaengine.memory;

import com.example.rcaengine.domain.RootCauseOutcome;
import com.example.rcaengine.repository.RootCauseOutcomeRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Root-cause memory - keeps confirmed outcomes of resolved incidents and
 * answers the historical factor from them.
 *
 * Rates are cached per component and alert pattern; recording an outcome
 * evicts the entries of every component it touches.
 */
@Slf4j
@Service
public class RootCauseHistoryService implements HistoricalOutcomeProvider {

    private final RootCauseOutcomeRepository outcomeRepository;

    /** "component|pattern" → confirmed root-cause rate */
    private final Cache<String, Double> rateCache;

    public RootCauseHistoryService(RootCauseOutcomeRepository outcomeRepository) {
        this.outcomeRepository = outcomeRepository;
        this.rateCache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public double getRootCauseRate(String componentId, String alertPattern) {
        return rateCache.get(cacheKey(componentId, alertPattern), key -> {
            long total = outcomeRepository.countByComponentIdAndAlertPattern(componentId, alertPattern);
            if (total == 0) return 0.0;
            long confirmed = outcomeRepository.countByComponentIdAndAlertPatternAndConfirmedTrue(componentId, alertPattern);
            return (double) confirmed / total;
        });
    }

    @Override
    public List<String> getFixReferences(String componentId, String alertPattern) {
        return outcomeRepository.findConfirmedFixes(componentId, alertPattern).stream()
                .map(RootCauseOutcome::getFixReference)
                .distinct()
                .toList();
    }

    public boolean hasOutcome(String incidentId) {
        return outcomeRepository.existsByIncidentId(incidentId);
    }

    /**
     * Record the outcome of a resolved incident: one row per alerting
     * component, confirmed for the actual root cause only.
     *
     * @param patternByComponent alert pattern of every component that alerted in the incident
     */
    @Transactional
    public List<RootCauseOutcome> recordOutcome(String incidentId, Map<String, String> patternByComponent,
                                                String confirmedComponentId, String fixReference) {
        if (!patternByComponent.containsKey(confirmedComponentId)) {
            throw new IllegalArgumentException("Component " + confirmedComponentId
                    + " did not alert in incident " + incidentId);
        }

        Instant now = Instant.now();
        List<RootCauseOutcome> outcomes = new ArrayList<>();
        patternByComponent.forEach((componentId, pattern) -> {
            boolean confirmed = componentId.equals(confirmedComponentId);
            outcomes.add(RootCauseOutcome.builder()
                    .incidentId(incidentId)
                    .componentId(componentId)
                    .alertPattern(pattern)
                    .confirmed(confirmed)
                    .fixReference(confirmed ? fixReference : null)
                    .recordedAt(now)
                    .build());
        });
        List<RootCauseOutcome> saved = outcomeRepository.saveAll(outcomes);
        patternByComponent.forEach((componentId, pattern) -> rateCache.invalidate(cacheKey(componentId, pattern)));
        log.info("Recorded root cause {} for incident {} ({} components)",
                confirmedComponentId, incidentId, saved.size());
        return saved;
    }

    private static String cacheKey(String componentId, String alertPattern) {
        return componentId + "|" + alertPattern;
    }
}
