package com.example.rcaengine.topology;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Criticality tier of a component. Tier 1 is core infrastructure whose
 * failure takes others down with it.
 */
public enum Criticality {
    CRITICAL(1, 1.0),
    HIGH(2, 0.75),
    MEDIUM(3, 0.5),
    LOW(4, 0.25);

    private final int tier;
    private final double score;

    Criticality(int tier, double score) {
        this.tier = tier;
        this.score = score;
    }

    public int getTier() {
        return tier;
    }

    /** Criticality factor used by root-cause scoring, in [0,1]. */
    public double getScore() {
        return score;
    }

    @JsonCreator
    public static Criticality parse(String value) {
        if (value == null || value.isBlank()) return HIGH;
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "critical", "tier-1", "tier1", "1" -> CRITICAL;
            case "high", "tier-2", "tier2", "2" -> HIGH;
            case "medium", "tier-3", "tier3", "3" -> MEDIUM;
            case "low", "tier-4", "tier4", "4" -> LOW;
            default -> throw new IllegalArgumentException("Unknown criticality: " + value);
        };
    }
}
