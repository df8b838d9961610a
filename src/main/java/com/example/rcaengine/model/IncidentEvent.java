package com.example.rcaengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Incident stream entry, emitted on every change of an incident.
 */
@Value
@Builder
public class IncidentEvent {

    String incidentId;
    IncidentStatus status;
    List<String> memberAlertIds;
    List<String> affectedComponents;
    RootCauseHypothesis rootCause;
    boolean storm;
    Severity severity;
    IncidentPriority priority;
    String summary;
    /** labels every member alert carries with the same value */
    Map<String, String> commonLabels;
    /** first ten distinct {@code instance} labels of the members */
    List<String> affectedInstances;
    int instanceCount;
    long revision;
    Instant windowStart;
    Instant windowEnd;
    CloseReason closeReason;
    String mergedInto;
    String reopenedFrom;
}
