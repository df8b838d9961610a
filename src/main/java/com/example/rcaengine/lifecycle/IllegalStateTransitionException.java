package com.example.rcaengine.lifecycle;

import com.example.rcaengine.model.IncidentStatus;

/**
 * Raised when an operation would move an incident along a transition the
 * lifecycle does not allow, such as mitigating a resolved incident.
 */
public class IllegalStateTransitionException extends RuntimeException {

    private final String incidentId;

    public IllegalStateTransitionException(String incidentId, IncidentStatus from, IncidentStatus to) {
        this(incidentId, String.format("Incident %s cannot move from %s to %s", incidentId, from, to));
    }

    public IllegalStateTransitionException(String incidentId, String message) {
        super(message);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
