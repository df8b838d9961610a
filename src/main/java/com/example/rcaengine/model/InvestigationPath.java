package com.example.rcaengine.model;

import java.util.List;

/**
 * Ordered investigation steps for an incident, generated on demand from the
 * current hypothesis and not stored.
 */
public record InvestigationPath(String incidentId, long revision, List<InvestigationStep> steps) {

    public static InvestigationPath empty(String incidentId, long revision) {
        return new InvestigationPath(incidentId, revision, List.of());
    }
}
