package com.example.rcaengine.service;

import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.domain.ComponentDependency;
import com.example.rcaengine.domain.TopologyComponent;
import com.example.rcaengine.repository.ComponentDependencyRepository;
import com.example.rcaengine.repository.TopologyComponentRepository;
import com.example.rcaengine.topology.TopologyEdge;
import com.example.rcaengine.topology.TopologyNode;
import com.example.rcaengine.topology.TopologySnapshot;
import com.example.rcaengine.topology.TopologyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies topology feed records. Every accepted change is persisted and then
 * published to the in-memory {@link TopologyStore} as a fresh snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopologySyncService {

    private final TopologyComponentRepository componentRepository;
    private final ComponentDependencyRepository dependencyRepository;
    private final TopologyStore topologyStore;
    private final AuditService auditService;

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        try {
            reload();
        } catch (Exception e) {
            // Topology unavailable: correlation falls back to temporal and label matching
            log.warn("Could not load topology at startup, continuing without it: {}", e.getMessage());
        }
    }

    /**
     * Replace the whole topology with the given records.
     */
    @Transactional
    public TopologySnapshot replaceAll(List<TopologyComponent> components, List<ComponentDependency> dependencies) {
        Set<String> ids = new HashSet<>();
        for (TopologyComponent component : components) {
            validateComponent(component);
            if (!ids.add(component.getId())) {
                throw new IllegalArgumentException("Duplicate component id: " + component.getId());
            }
        }
        for (ComponentDependency dependency : dependencies) {
            validateDependency(dependency, ids);
        }

        dependencyRepository.deleteAllInBatch();
        componentRepository.deleteAll();
        componentRepository.flush();
        componentRepository.saveAll(components);
        dependencyRepository.saveAll(dependencies);

        auditService.log("topology-feed", AuditAction.TOPOLOGY_SYNCED, null,
                Map.of("components", components.size(), "dependencies", dependencies.size()));
        return reload();
    }

    @Transactional
    public TopologyComponent upsertComponent(TopologyComponent component) {
        validateComponent(component);
        TopologyComponent saved = componentRepository.save(component);
        reload();
        return saved;
    }

    @Transactional
    public boolean deleteComponent(String componentId) {
        if (!componentRepository.existsById(componentId)) {
            return false;
        }
        int removedEdges = dependencyRepository.deleteTouching(componentId);
        componentRepository.deleteById(componentId);
        log.info("Removed component {} and {} dependencies", componentId, removedEdges);
        reload();
        return true;
    }

    @Transactional
    public ComponentDependency upsertDependency(ComponentDependency dependency) {
        Set<String> known = new HashSet<>(componentRepository.findAll().stream().map(TopologyComponent::getId).toList());
        validateDependency(dependency, known);
        ComponentDependency target = dependencyRepository
                .findByFromComponentIdAndToComponentId(dependency.getFromComponentId(), dependency.getToComponentId())
                .map(existing -> {
                    existing.setKind(dependency.getKind());
                    existing.setFailureImpact(dependency.getFailureImpact());
                    return existing;
                })
                .orElse(dependency);
        ComponentDependency saved = dependencyRepository.save(target);
        reload();
        return saved;
    }

    @Transactional
    public boolean deleteDependency(String fromComponentId, String toComponentId) {
        return dependencyRepository.findByFromComponentIdAndToComponentId(fromComponentId, toComponentId)
                .map(existing -> {
                    dependencyRepository.delete(existing);
                    reload();
                    return true;
                })
                .orElse(false);
    }

    /**
     * Rebuild the in-memory snapshot from the persisted records.
     */
    public TopologySnapshot reload() {
        List<TopologyNode> nodes = componentRepository.findAll().stream()
                .map(TopologyComponent::toNode)
                .toList();
        Set<String> known = new HashSet<>(nodes.stream().map(TopologyNode::id).toList());
        List<TopologyEdge> edges = dependencyRepository.findAll().stream()
                .filter(d -> known.contains(d.getFromComponentId()) && known.contains(d.getToComponentId()))
                .map(ComponentDependency::toEdge)
                .toList();
        return topologyStore.replace(nodes, edges);
    }

    private void validateComponent(TopologyComponent component) {
        if (component.getId() == null || component.getId().isBlank()) {
            throw new IllegalArgumentException("Component id is required");
        }
    }

    private void validateDependency(ComponentDependency dependency, Set<String> knownComponents) {
        String from = dependency.getFromComponentId();
        String to = dependency.getToComponentId();
        if (from == null || to == null) {
            throw new IllegalArgumentException("Dependency requires fromComponentId and toComponentId");
        }
        if (from.equals(to)) {
            throw new IllegalArgumentException("Self-dependency is not allowed: " + from);
        }
        if (!knownComponents.contains(from) || !knownComponents.contains(to)) {
            throw new IllegalArgumentException("Dependency references unknown component: " + from + " -> " + to);
        }
    }
}
