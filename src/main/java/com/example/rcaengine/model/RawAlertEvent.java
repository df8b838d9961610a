package com.example.rcaengine.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Inbound alert as pushed by the alert feed, before normalization.
 * Field names follow the Alertmanager webhook payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawAlertEvent {

    private String fingerprint;

    /** Alert name; falls back to the 'alertname' label when absent */
    private String name;

    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    /** Falls back to the 'severity' label when absent */
    private String severity;

    @JsonAlias({"started_at", "startsAt"})
    private Instant startedAt;

    @JsonAlias("ends_at")
    private Instant endsAt;

    /** "firing" or "resolved" */
    private String status;
}
