package com.example.rcaengine.correlation;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.topology.TopologySnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Matches when the alert shares the value of a correlating label
 * (deployment, host, pod, ...) with any member alert.
 */
@Component
@RequiredArgsConstructor
public class SharedLabelWindowMatcher implements WindowMatcher {

    private final EngineProperties properties;

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.LABEL;
    }

    @Override
    public boolean matches(Alert alert, WindowSnapshot window, TopologySnapshot topology) {
        for (String label : properties.getCorrelation().getCorrelatingLabels()) {
            String value = alert.getLabels().get(label);
            if (value == null || value.isBlank()) continue;
            boolean shared = window.members().stream()
                    .anyMatch(member -> Objects.equals(value, member.getLabels().get(label)));
            if (shared) return true;
        }
        return false;
    }
}
