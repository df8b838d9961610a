package com.example.rcaengine.memory;

import java.util.List;

/**
 * Past outcomes of incidents, queried per component and alert pattern.
 * Implementations may be slow; callers go through {@link BoundedLookup}.
 */
public interface HistoricalOutcomeProvider {

    /**
     * Share of past resolved incidents with this component and alert pattern
     * where the component was the confirmed root cause, in [0,1]. Zero without history.
     */
    double getRootCauseRate(String componentId, String alertPattern);

    /** References to fixes that resolved the same component and pattern before, newest first. */
    List<String> getFixReferences(String componentId, String alertPattern);
}
