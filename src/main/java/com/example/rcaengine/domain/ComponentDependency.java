package com.example.rcaengine.domain;

import com.example.rcaengine.topology.DependencyKind;
import com.example.rcaengine.topology.TopologyEdge;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Directed edge of the dependency graph: the from component depends on the to component.
 */
@Entity
@Table(name = "component_dependencies", uniqueConstraints = {
        @UniqueConstraint(name = "uk_dependency_edge", columnNames = {"from_component_id", "to_component_id"})
}, indexes = {
        @Index(name = "idx_dependency_from", columnList = "from_component_id"),
        @Index(name = "idx_dependency_to", columnList = "to_component_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentDependency {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "from_component_id", nullable = false)
    private String fromComponentId;

    @Column(name = "to_component_id", nullable = false)
    private String toComponentId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private DependencyKind kind = DependencyKind.SYNC;

    /** What happens to the dependent when this dependency fails */
    @Column(name = "failure_impact", length = 1024)
    private String failureImpact;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public TopologyEdge toEdge() {
        return new TopologyEdge(fromComponentId, toComponentId, kind, failureImpact);
    }
}
