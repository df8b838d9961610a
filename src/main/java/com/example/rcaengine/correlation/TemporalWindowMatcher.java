package com.example.rcaengine.correlation;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.topology.TopologySnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Matches when the alert started within the grace period of the window:
 * {@code window_start - grace <= started_at <= window_end + grace}.
 * Both bounds are inclusive; the lower bound admits late-delivered alerts.
 */
@Component
@RequiredArgsConstructor
public class TemporalWindowMatcher implements WindowMatcher {

    private final EngineProperties properties;

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.TEMPORAL;
    }

    @Override
    public boolean matches(Alert alert, WindowSnapshot window, TopologySnapshot topology) {
        Duration grace = Duration.ofMinutes(properties.getCorrelation().getGracePeriodMinutes());
        Instant t = alert.getStartedAt();
        return !t.isBefore(window.windowStart().minus(grace))
                && !t.isAfter(window.windowEnd().plus(grace));
    }
}
