package com.example.rcaengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full read model of an incident for operators: membership, hypothesis,
 * lifecycle timestamps and response metrics.
 */
@Value
@Builder
public class IncidentView {

    String id;
    IncidentStatus status;
    Instant windowStart;
    Instant windowEnd;
    List<Alert> alerts;
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
    CloseReason closeReason;
    String mergedInto;
    String reopenedFrom;
    String reopenedAs;

    Instant createdAt;
    Instant acknowledgedAt;
    Instant identifiedAt;
    Instant mitigatedAt;
    Instant resolvedAt;

    Long timeToAcknowledgeSeconds;
    Long timeToIdentifySeconds;
    Long timeToResolveSeconds;
}
