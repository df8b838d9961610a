package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a past incident for one candidate component. Written when an
 * operator confirms the root cause of a resolved incident; read back as the
 * historical factor of future scoring.
 */
@Entity
@Table(name = "root_cause_outcomes", indexes = {
        @Index(name = "idx_outcome_component_pattern", columnList = "component_id, alert_pattern"),
        @Index(name = "idx_outcome_incident", columnList = "incident_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RootCauseOutcome {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Column(name = "component_id", nullable = false)
    private String componentId;

    @Column(name = "alert_pattern", nullable = false)
    private String alertPattern;

    /** Whether this component was the confirmed root cause of the incident */
    private boolean confirmed;

    /** Opaque reference to the fix summary owned by the knowledge base */
    @Column(name = "fix_reference")
    private String fixReference;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) recordedAt = Instant.now();
    }
}
