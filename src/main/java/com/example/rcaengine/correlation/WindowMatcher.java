package com.example.rcaengine.correlation;

import com.example.rcaengine.model.Alert;
import com.example.rcaengine.topology.TopologySnapshot;

/**
 * One correlation strategy. Implementations are pure: they read the alert,
 * a window snapshot and a topology snapshot and mutate nothing.
 */
public interface WindowMatcher {

    MatchStrategy strategy();

    boolean matches(Alert alert, WindowSnapshot window, TopologySnapshot topology);
}
