package com.example.rcaengine.correlation;

import com.example.rcaengine.model.IncidentEvent;

/**
 * Outcome of handing one alert to the window manager.
 *
 * @param strategy the matching strategy for APPENDED, null otherwise
 * @param event    the window's state right after the mutation, null when nothing changed
 */
public record CorrelationResult(CorrelationWindow window, Outcome outcome, MatchStrategy strategy, IncidentEvent event) {

    public enum Outcome {
        /** Alert opened a new window */
        OPENED,
        /** Alert joined an existing window */
        APPENDED,
        /** Same fingerprint and start time already ingested */
        DUPLICATE,
        /** A member alert reported resolved */
        MEMBER_RESOLVED,
        /** Nothing changed */
        UNCHANGED
    }

    public boolean changedMembership() {
        return outcome == Outcome.OPENED || outcome == Outcome.APPENDED || outcome == Outcome.MEMBER_RESOLVED;
    }
}
