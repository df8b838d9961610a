package com.example.rcaengine.correlation;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.topology.TopologySnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Matches when the alert's component is upstream or downstream, within
 * {@code max-hops}, of a component already in the window. Unmatched alerts
 * and an empty topology never match here.
 */
@Component
@RequiredArgsConstructor
public class TopologicalWindowMatcher implements WindowMatcher {

    private final EngineProperties properties;

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.TOPOLOGICAL;
    }

    @Override
    public boolean matches(Alert alert, WindowSnapshot window, TopologySnapshot topology) {
        if (!alert.hasComponent() || topology.isEmpty()) return false;
        int maxHops = properties.getCorrelation().getMaxHops();
        return window.components().stream()
                .anyMatch(component -> topology.related(alert.getComponentId(), component, maxHops));
    }
}
