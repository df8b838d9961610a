package com.example.rcaengine.domain;

import com.example.rcaengine.topology.Criticality;
import com.example.rcaengine.topology.TopologyNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Component record as last accepted from the topology feed.
 */
@Entity
@Table(name = "topology_components")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopologyComponent {

    /** Natural id supplied by the topology feed (e.g. "db-primary") */
    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    /** compute, database, cache, queue, storage, external, ... */
    @Column(name = "component_type")
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Criticality criticality = Criticality.HIGH;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "component_label_matchers", joinColumns = @JoinColumn(name = "component_id"))
    @MapKeyColumn(name = "label")
    @Column(name = "pattern")
    @Builder.Default
    private Map<String, String> labelMatchers = new HashMap<>();

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
        if (name == null) name = id;
    }

    public TopologyNode toNode() {
        return new TopologyNode(id, name != null ? name : id, type, criticality, labelMatchers);
    }
}
