package com.example.rcaengine.topology;

import com.example.rcaengine.EngineFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopologySnapshotTest {

    private static TopologyNode node(String id) {
        return new TopologyNode(id, id, "compute", null, Map.of());
    }

    private static TopologyEdge edge(String from, String to) {
        return new TopologyEdge(from, to, DependencyKind.SYNC, null);
    }

    @Test
    void upstreamAndDownstreamFollowDependencyDirection() {
        TopologySnapshot topology = EngineFixtures.chainTopology();

        assertEquals(Map.of("api", 1, "db-primary", 2), topology.upstream("web", 2));
        assertEquals(Map.of("api", 1, "web", 2), topology.downstream("db-primary", 2));
        assertEquals(Map.of("api", 1), topology.upstream("web", 1));
        assertTrue(topology.upstream("db-primary", 2).isEmpty());
    }

    @Test
    void relatedWithinHopsButNeverToItself() {
        TopologySnapshot topology = EngineFixtures.chainTopology();

        assertTrue(topology.related("web", "db-primary", 2));
        assertTrue(topology.related("db-primary", "web", 2));
        assertFalse(topology.related("web", "db-primary", 1));
        assertFalse(topology.related("api", "api", 2));
        assertFalse(topology.related("api", "unknown", 2));
    }

    @Test
    void traversalTerminatesOnCycles() {
        TopologySnapshot cyclic = TopologySnapshot.of(1,
                List.of(node("a"), node("b"), node("c")),
                List.of(edge("a", "b"), edge("b", "c"), edge("c", "a")));

        Map<String, Integer> reached = cyclic.upstream("a", 10);

        assertEquals(Map.of("b", 1, "c", 2), reached);
        assertEquals(Map.of("c", 1, "b", 2), cyclic.downstream("a", 10));
    }

    @Test
    void duplicateEdgesAreCollapsed() {
        TopologySnapshot topology = TopologySnapshot.of(1,
                List.of(node("a"), node("b")),
                List.of(edge("a", "b"), edge("a", "b")));

        assertEquals(1, topology.edges().size());
        assertEquals(List.of("b"), topology.dependenciesOf("a"));
        assertEquals(List.of("a"), topology.dependentsOf("b"));
    }

    @Test
    void selfLoopIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> edge("a", "a"));
    }

    @Test
    void componentsDefaultToHighCriticality() {
        assertEquals(Criticality.HIGH, node("a").criticality());
        assertEquals(Criticality.CRITICAL, Criticality.parse("tier-1"));
        assertEquals(Criticality.LOW, Criticality.parse("low"));
        assertThrows(IllegalArgumentException.class, () -> Criticality.parse("tier-9"));
    }

    @Test
    void labelMatchersSupportExactAndPrefix() {
        Map<String, String> labels = Map.of("service", "checkout", "pod", "checkout-7f9c");

        assertEquals(2, LabelMatchers.specificity(labels, Map.of("service", "checkout", "pod", "checkout-*")));
        assertEquals(1, LabelMatchers.specificity(labels, Map.of("pod", "check*")));
        assertEquals(-1, LabelMatchers.specificity(labels, Map.of("service", "checkout", "host", "h1")));
        assertEquals(-1, LabelMatchers.specificity(labels, Map.of()));
    }

    @Test
    void storeSwapsVersionedSnapshots() {
        TopologyStore store = new TopologyStore();
        assertFalse(store.isAvailable());

        TopologySnapshot first = store.replace(List.of(node("a")), List.of());
        TopologySnapshot second = store.replace(List.of(node("a"), node("b")), List.of(edge("a", "b")));

        assertEquals(first.getVersion() + 1, second.getVersion());
        assertSame(second, store.current());
        assertTrue(store.isAvailable());
        assertEquals(1, first.nodes().size());
    }
}
