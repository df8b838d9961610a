package com.example.rcaengine.model;

import java.time.Instant;

/**
 * Score of one alerting component. {@code inDegree} counts in-window causal
 * edges pointing at the component; zero marks a root candidate.
 */
public record CandidateScore(
        String componentId,
        double score,
        ContributingFactors factors,
        Instant earliestAlertAt,
        int inDegree,
        String alertPattern) {

    public boolean isRootCandidate() {
        return inDegree == 0;
    }
}
