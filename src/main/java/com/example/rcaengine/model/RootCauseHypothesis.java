package com.example.rcaengine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The engine's best current guess for a window. Always replaced as a whole,
 * never patched; {@code revision} is the window revision it was computed from.
 */
@Value
@Builder
public class RootCauseHypothesis {

    String componentId;
    double confidence;
    boolean lowConfidence;
    ContributingFactors contributingFactors;
    @Singular("causalEdge")
    List<CausalEdge> causalChain;
    /** Every scored component, highest score first */
    @Singular
    List<CandidateScore> candidates;
    long revision;
    /** True when any collaborator lookup fell back to its default */
    boolean degraded;
}
