package com.example.rcaengine.analysis;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.CausalEdge;
import com.example.rcaengine.topology.Criticality;
import com.example.rcaengine.topology.TopologyNode;
import com.example.rcaengine.topology.TopologySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Causal Graph Builder - derives cause → effect edges between the alerting
 * components of a window.
 *
 * An edge C → E exists when E depends on C within {@code max-hops} and C
 * started alerting no later than E. The walk from E follows dependencies
 * only, stops at the first alerting component on each path and keeps a
 * visited set, so each walk touches at most components × hops nodes even on
 * cyclic topologies. Components missing from the topology are kept as
 * isolated alerting nodes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CausalGraphBuilder {

    private final EngineProperties properties;

    public CausalGraph build(Collection<Alert> members, TopologySnapshot topology) {
        int maxHops = properties.getCorrelation().getMaxHops();
        Map<String, CausalGraph.AlertingComponent> alerting = alertingComponents(members, topology);

        Set<String> nodes = new TreeSet<>(alerting.keySet());
        for (String id : alerting.keySet()) {
            nodes.addAll(topology.upstream(id, maxHops).keySet());
            nodes.addAll(topology.downstream(id, maxHops).keySet());
        }

        List<CausalEdge> edges = new ArrayList<>();
        for (CausalGraph.AlertingComponent effect : alerting.values()) {
            for (String causeId : nearestAlertingDependencies(effect.componentId(), alerting.keySet(), topology, maxHops)) {
                CausalGraph.AlertingComponent cause = alerting.get(causeId);
                if (cause.earliestAlertAt().isAfter(effect.earliestAlertAt())) continue;
                long delay = Duration.between(cause.earliestAlertAt(), effect.earliestAlertAt()).getSeconds();
                edges.add(new CausalEdge(causeId, effect.componentId(), delay));
            }
        }
        edges.sort(Comparator.comparing(CausalEdge::from).thenComparing(CausalEdge::to));

        log.debug("Causal graph: {} alerting of {} nodes, {} edges", alerting.size(), nodes.size(), edges.size());
        return new CausalGraph(alerting, nodes, edges);
    }

    /** Firing components keyed by id, each with its earliest alert. */
    private Map<String, CausalGraph.AlertingComponent> alertingComponents(Collection<Alert> members,
                                                                         TopologySnapshot topology) {
        Map<String, Alert> earliest = new TreeMap<>();
        for (Alert alert : members) {
            if (!alert.isFiring() || !alert.hasComponent()) continue;
            earliest.merge(alert.getComponentId(), alert, (a, b) -> earlierOf(a, b));
        }
        Map<String, CausalGraph.AlertingComponent> alerting = new TreeMap<>();
        earliest.forEach((id, alert) -> {
            Criticality criticality = topology.node(id).map(TopologyNode::criticality).orElse(Criticality.MEDIUM);
            alerting.put(id, new CausalGraph.AlertingComponent(id, alert.getStartedAt(), alert.alertPattern(),
                    criticality));
        });
        return alerting;
    }

    private static Alert earlierOf(Alert a, Alert b) {
        int byTime = a.getStartedAt().compareTo(b.getStartedAt());
        if (byTime != 0) return byTime < 0 ? a : b;
        return a.getId().compareTo(b.getId()) <= 0 ? a : b;
    }

    private Set<String> nearestAlertingDependencies(String start, Set<String> alerting,
                                                    TopologySnapshot topology, int maxHops) {
        Set<String> found = new TreeSet<>();
        Set<String> visited = new HashSet<>();
        visited.add(start);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(start);

        for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (String dependency : topology.dependenciesOf(current)) {
                    if (!visited.add(dependency)) continue;
                    if (alerting.contains(dependency)) {
                        found.add(dependency);
                    } else {
                        next.add(dependency);
                    }
                }
            }
            frontier = next;
        }
        return found;
    }
}
