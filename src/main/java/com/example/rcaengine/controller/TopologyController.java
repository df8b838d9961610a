package com.example.rcaengine.controller;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.domain.ComponentDependency;
import com.example.rcaengine.domain.TopologyComponent;
import com.example.rcaengine.service.TopologySyncService;
import com.example.rcaengine.topology.TopologyGraphView;
import com.example.rcaengine.topology.TopologySnapshot;
import com.example.rcaengine.topology.TopologyStore;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Topology feed REST API Controller.
 */
@RestController
@RequestMapping("/api/topology")
@RequiredArgsConstructor
public class TopologyController {

    private final TopologySyncService syncService;
    private final TopologyStore topologyStore;
    private final EngineProperties properties;

    @GetMapping
    public ResponseEntity<TopologyGraphView> getGraph() {
        return ResponseEntity.ok(TopologyGraphView.of(topologyStore.current()));
    }

    /**
     * Full sync: replaces every component and dependency.
     */
    @PutMapping
    public ResponseEntity<TopologyGraphView> replaceTopology(@RequestBody TopologySyncRequest request) {
        TopologySnapshot snapshot = syncService.replaceAll(request.getComponents(), request.getDependencies());
        return ResponseEntity.ok(TopologyGraphView.of(snapshot));
    }

    @PostMapping("/components")
    public ResponseEntity<TopologyComponent> upsertComponent(@RequestBody TopologyComponent component) {
        return ResponseEntity.ok(syncService.upsertComponent(component));
    }

    @DeleteMapping("/components/{id}")
    public ResponseEntity<Map<String, String>> deleteComponent(@PathVariable String id) {
        if (!syncService.deleteComponent(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @PostMapping("/dependencies")
    public ResponseEntity<ComponentDependency> upsertDependency(@RequestBody ComponentDependency dependency) {
        return ResponseEntity.ok(syncService.upsertDependency(dependency));
    }

    @DeleteMapping("/dependencies")
    public ResponseEntity<Map<String, String>> deleteDependency(@RequestParam String from, @RequestParam String to) {
        if (!syncService.deleteDependency(from, to)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "from", from, "to", to));
    }

    /** Components the given one depends on, with hop distance. */
    @GetMapping("/components/{id}/upstream")
    public ResponseEntity<List<Map<String, Object>>> upstream(@PathVariable String id,
                                                              @RequestParam(required = false) Integer hops) {
        TopologySnapshot snapshot = topologyStore.current();
        if (snapshot.node(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toHopList(snapshot.upstream(id, hops(hops))));
    }

    /** Components depending on the given one, with hop distance. */
    @GetMapping("/components/{id}/downstream")
    public ResponseEntity<List<Map<String, Object>>> downstream(@PathVariable String id,
                                                                @RequestParam(required = false) Integer hops) {
        TopologySnapshot snapshot = topologyStore.current();
        if (snapshot.node(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toHopList(snapshot.downstream(id, hops(hops))));
    }

    private int hops(Integer requested) {
        if (requested == null) return properties.getCorrelation().getMaxHops();
        if (requested < 1) throw new IllegalArgumentException("hops must be at least 1");
        return requested;
    }

    private static List<Map<String, Object>> toHopList(Map<String, Integer> reached) {
        List<Map<String, Object>> result = new ArrayList<>();
        reached.forEach((componentId, hop) -> result.add(Map.of("component_id", componentId, "hops", hop)));
        return result;
    }

    @Data
    public static class TopologySyncRequest {
        private List<TopologyComponent> components = new ArrayList<>();
        private List<ComponentDependency> dependencies = new ArrayList<>();
    }
}
