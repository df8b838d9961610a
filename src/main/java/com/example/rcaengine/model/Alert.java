package com.example.rcaengine.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Canonical alert as seen by the engine. Everything except the status and
 * resolution time is fixed at normalization; those two change only under
 * the lock of the window the alert belongs to.
 */
@Getter
@ToString
public class Alert {

    private final String id;
    private final String fingerprint;
    private final String name;
    /** Resolved topology component, null when no matcher applied */
    private final String componentId;
    private final Severity severity;
    private final Instant startedAt;
    private final Map<String, String> labels;

    private volatile AlertStatus status;
    private volatile Instant resolvedAt;

    @Builder
    private Alert(String fingerprint, String name, String componentId, Severity severity,
                  Instant startedAt, Map<String, String> labels, AlertStatus status, Instant resolvedAt) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Alert fingerprint is required");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Alert start time is required");
        }
        this.fingerprint = fingerprint;
        this.name = name != null ? name : "unknown";
        this.componentId = componentId;
        this.severity = severity != null ? severity : Severity.WARNING;
        this.startedAt = startedAt;
        this.labels = labels != null
                ? Collections.unmodifiableMap(new TreeMap<>(labels))
                : Map.of();
        this.status = status != null ? status : AlertStatus.FIRING;
        this.resolvedAt = resolvedAt;
        this.id = idFor(fingerprint, startedAt);
    }

    private Alert(Alert source) {
        this.id = source.id;
        this.fingerprint = source.fingerprint;
        this.name = source.name;
        this.componentId = source.componentId;
        this.severity = source.severity;
        this.startedAt = source.startedAt;
        this.labels = source.labels;
        this.status = source.status;
        this.resolvedAt = source.resolvedAt;
    }

    /** Detached copy carrying the status and resolution time as they are now. */
    public Alert copy() {
        return new Alert(this);
    }

    /** Deduplication key: the same fingerprint firing at the same instant is the same alert. */
    public String dedupKey() {
        return dedupKey(fingerprint, startedAt);
    }

    public static String dedupKey(String fingerprint, Instant startedAt) {
        return fingerprint + "@" + startedAt.toEpochMilli();
    }

    /** Stable id derived from the dedup key so that replays produce the same ids. */
    public static String idFor(String fingerprint, Instant startedAt) {
        return "ALR-" + UUID.nameUUIDFromBytes(dedupKey(fingerprint, startedAt).getBytes(StandardCharsets.UTF_8));
    }

    /** Pattern key used for historical and diagnostic lookups. */
    public String alertPattern() {
        return name;
    }

    public boolean isFiring() {
        return status == AlertStatus.FIRING;
    }

    public boolean hasComponent() {
        return componentId != null;
    }

    public void markResolved(Instant at) {
        this.status = AlertStatus.RESOLVED;
        this.resolvedAt = at;
    }
}
