package com.example.rcaengine.correlation;

/**
 * Correlation strategies in evaluation order. The first strategy that
 * matches any candidate window wins.
 */
public enum MatchStrategy {
    TEMPORAL, TOPOLOGICAL, LABEL
}
