package com.example.rcaengine.topology;

import java.util.Map;

/**
 * Immutable component as held by a topology snapshot.
 *
 * @param labelMatchers label name to pattern; a pattern ending in '*' is a prefix match
 */
public record TopologyNode(String id, String name, String type, Criticality criticality,
                           Map<String, String> labelMatchers) {

    public TopologyNode {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Component id is required");
        criticality = criticality != null ? criticality : Criticality.HIGH;
        labelMatchers = labelMatchers != null ? Map.copyOf(labelMatchers) : Map.of();
    }
}
