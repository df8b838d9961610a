package com.example.rcaengine.topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Immutable, versioned view of the dependency graph. Components are kept in
 * an id-keyed arena and edges refer to ids only, so cyclic topologies are
 * just data; every traversal carries its own visited set and hop bound.
 */
public final class TopologySnapshot {

    private static final TopologySnapshot EMPTY = new TopologySnapshot(0, List.of(), List.of());

    private final long version;
    private final Map<String, TopologyNode> nodes;
    private final List<TopologyEdge> edges;
    /** from → ids it depends on */
    private final Map<String, List<String>> dependencies;
    /** to → ids depending on it */
    private final Map<String, List<String>> dependents;

    private TopologySnapshot(long version, Collection<TopologyNode> nodes, Collection<TopologyEdge> edges) {
        this.version = version;

        Map<String, TopologyNode> arena = new TreeMap<>();
        for (TopologyNode node : nodes) {
            arena.put(node.id(), node);
        }
        this.nodes = Collections.unmodifiableMap(arena);

        Map<String, TopologyEdge> unique = new LinkedHashMap<>();
        for (TopologyEdge edge : edges) {
            unique.putIfAbsent(edge.from() + "->" + edge.to(), edge);
        }
        this.edges = List.copyOf(unique.values());

        Map<String, List<String>> deps = new TreeMap<>();
        Map<String, List<String>> rdeps = new TreeMap<>();
        for (TopologyEdge edge : this.edges) {
            deps.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            rdeps.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge.from());
        }
        deps.values().forEach(Collections::sort);
        rdeps.values().forEach(Collections::sort);
        this.dependencies = freeze(deps);
        this.dependents = freeze(rdeps);
    }

    public static TopologySnapshot of(long version, Collection<TopologyNode> nodes, Collection<TopologyEdge> edges) {
        return new TopologySnapshot(version, nodes, edges);
    }

    public static TopologySnapshot empty() {
        return EMPTY;
    }

    public long getVersion() {
        return version;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<TopologyNode> node(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    public Collection<TopologyNode> nodes() {
        return nodes.values();
    }

    public List<TopologyEdge> edges() {
        return edges;
    }

    public Optional<TopologyEdge> edge(String from, String to) {
        return edges.stream().filter(e -> e.from().equals(from) && e.to().equals(to)).findFirst();
    }

    /** Components {@code id} depends on directly. */
    public List<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, List.of());
    }

    /** Components that depend on {@code id} directly. */
    public List<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, List.of());
    }

    /**
     * Components {@code id} depends on, transitively, within {@code maxHops}.
     * Values are hop distances; iteration order is BFS order.
     */
    public Map<String, Integer> upstream(String id, int maxHops) {
        return traverse(id, maxHops, this::dependenciesOf);
    }

    /** Components depending on {@code id}, transitively, within {@code maxHops}. */
    public Map<String, Integer> downstream(String id, int maxHops) {
        return traverse(id, maxHops, this::dependentsOf);
    }

    /**
     * Whether {@code other} is upstream or downstream of {@code id} at a
     * distance between 1 and {@code maxHops}. A component is not related to itself.
     */
    public boolean related(String id, String other, int maxHops) {
        if (id == null || other == null || id.equals(other)) return false;
        return upstream(id, maxHops).containsKey(other) || downstream(id, maxHops).containsKey(other);
    }

    private Map<String, Integer> traverse(String start, int maxHops, Function<String, List<String>> next) {
        Map<String, Integer> reached = new LinkedHashMap<>();
        if (start == null || maxHops <= 0) return reached;

        Set<String> visited = new HashSet<>();
        visited.add(start);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(start);

        for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
            Deque<String> nextFrontier = new ArrayDeque<>();
            for (String current : frontier) {
                for (String neighbour : next.apply(current)) {
                    if (visited.add(neighbour)) {
                        reached.put(neighbour, hop);
                        nextFrontier.add(neighbour);
                    }
                }
            }
            frontier = nextFrontier;
        }
        return reached;
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> adjacency) {
        Map<String, List<String>> frozen = new TreeMap<>();
        adjacency.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
