package com.example.rcaengine.model;

/**
 * Incident lifecycle states. Transitions only move forward; a resolved
 * incident is never reopened in place.
 */
public enum IncidentStatus {
    OPEN, INVESTIGATING, IDENTIFIED, MITIGATED, RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    public boolean canTransitionTo(IncidentStatus target) {
        if (target == null || target == this || isTerminal()) return false;
        return switch (target) {
            case OPEN -> false;
            case INVESTIGATING -> this == OPEN;
            case IDENTIFIED -> this == INVESTIGATING;
            case MITIGATED -> true;
            case RESOLVED -> true;
        };
    }
}
