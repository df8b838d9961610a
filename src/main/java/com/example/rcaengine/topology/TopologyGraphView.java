package com.example.rcaengine.topology;

import java.util.List;

/**
 * Serializable {nodes, edges} view of a topology snapshot.
 */
public record TopologyGraphView(long version, List<TopologyNode> nodes, List<TopologyEdge> edges) {

    public static TopologyGraphView of(TopologySnapshot snapshot) {
        return new TopologyGraphView(snapshot.getVersion(), List.copyOf(snapshot.nodes()), snapshot.edges());
    }
}
