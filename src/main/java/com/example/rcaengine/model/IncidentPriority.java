package com.example.rcaengine.model;

/**
 * Urgency presented downstream. Follows the highest member severity; an
 * alert storm raises it by one level.
 */
public enum IncidentPriority {
    P1, P2, P3, P4;

    public static IncidentPriority of(Severity severity, boolean storm) {
        IncidentPriority base = switch (severity) {
            case CRITICAL -> P1;
            case HIGH -> P2;
            case WARNING -> P3;
            case INFO -> P4;
        };
        return storm && base != P1 ? values()[base.ordinal() - 1] : base;
    }
}
