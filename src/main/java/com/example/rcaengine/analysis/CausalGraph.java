package com.example.rcaengine.analysis;

import com.example.rcaengine.model.CausalEdge;
import com.example.rcaengine.topology.Criticality;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed cause → effect graph of one window.
 *
 * {@code nodes} holds alerting components plus their topology neighbourhood;
 * edges only ever connect alerting components.
 */
public final class CausalGraph {

    private final Map<String, AlertingComponent> alerting;
    private final Set<String> nodes;
    private final List<CausalEdge> edges;

    CausalGraph(Map<String, AlertingComponent> alerting, Set<String> nodes, List<CausalEdge> edges) {
        this.alerting = Collections.unmodifiableMap(alerting);
        this.nodes = Collections.unmodifiableSet(nodes);
        this.edges = List.copyOf(edges);
    }

    public Map<String, AlertingComponent> alerting() {
        return alerting;
    }

    public Set<String> nodes() {
        return nodes;
    }

    public List<CausalEdge> edges() {
        return edges;
    }

    public boolean isEmpty() {
        return alerting.isEmpty();
    }

    public int inDegree(String componentId) {
        return (int) edges.stream().filter(e -> e.to().equals(componentId)).count();
    }

    /** Effects of {@code componentId}, earliest alert first then by id. */
    public List<CausalEdge> outgoing(String componentId) {
        return edges.stream()
                .filter(e -> e.from().equals(componentId))
                .sorted(Comparator.comparing((CausalEdge e) -> alerting.get(e.to()).earliestAlertAt())
                        .thenComparing(CausalEdge::to))
                .toList();
    }

    /**
     * A component with at least one firing alert in the window.
     *
     * @param alertPattern pattern of its earliest alert
     */
    public record AlertingComponent(String componentId, Instant earliestAlertAt, String alertPattern,
                                    Criticality criticality) {
    }
}
