package com.example.rcaengine.topology;

/**
 * Directed "depends-on" edge: {@code from} depends on {@code to}.
 * Failures therefore propagate from {@code to} towards {@code from}.
 */
public record TopologyEdge(String from, String to, DependencyKind kind, String failureImpact) {

    public TopologyEdge {
        if (from == null || to == null) throw new IllegalArgumentException("Dependency endpoints are required");
        if (from.equals(to)) throw new IllegalArgumentException("Self-dependency is not allowed: " + from);
        kind = kind != null ? kind : DependencyKind.SYNC;
    }
}
