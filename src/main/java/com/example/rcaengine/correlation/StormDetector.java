package com.example.rcaengine.correlation;

import com.example.rcaengine.model.Alert;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * A storm is {@code threshold} or more alerts starting within one grace
 * period of each other.
 */
public final class StormDetector {

    private StormDetector() {
    }

    public static boolean isStorm(Collection<Alert> alerts, Duration grace, int threshold) {
        if (threshold <= 1) return !alerts.isEmpty();
        if (alerts.size() < threshold) return false;

        List<Instant> starts = alerts.stream().map(Alert::getStartedAt).sorted().toList();
        for (int i = 0; i + threshold - 1 < starts.size(); i++) {
            Instant first = starts.get(i);
            Instant last = starts.get(i + threshold - 1);
            if (!last.isAfter(first.plus(grace))) {
                return true;
            }
        }
        return false;
    }
}
