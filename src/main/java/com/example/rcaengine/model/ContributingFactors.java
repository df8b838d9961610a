package com.example.rcaengine.model;

/**
 * Breakdown of a candidate's root-cause score. Each factor is in [0,1].
 * When the historical lookup degraded, {@code historicalDegraded} is set and
 * the remaining weights were re-normalized.
 */
public record ContributingFactors(
        double timeFactor,
        double dependencyFactor,
        double historicalFactor,
        double criticalityFactor,
        boolean historicalDegraded,
        String weightsVersion) {
}
