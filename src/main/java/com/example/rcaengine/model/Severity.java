package com.example.rcaengine.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;

/**
 * Alert severity as reported by the monitoring source, normalized to four levels.
 */
public enum Severity {
    CRITICAL, HIGH, WARNING, INFO;

    /**
     * Lenient parse: unknown or missing values fall back to WARNING.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) return WARNING;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "page", "fatal" -> CRITICAL;
            case "high", "error", "major" -> HIGH;
            case "info", "low", "none" -> INFO;
            default -> WARNING;
        };
    }

    /**
     * Most severe of the given values, INFO when there are none.
     */
    public static Severity highest(Collection<Severity> severities) {
        return severities.stream().min(Comparator.naturalOrder()).orElse(INFO);
    }
}
