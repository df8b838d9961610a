package com.example.rcaengine.correlation;

import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.IncidentStatus;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of a window, republished after every mutation. Matching
 * and hypothesis computation read snapshots so they never hold a window lock.
 * Members are copies, so a later status change of an alert does not show
 * through an older snapshot.
 *
 * @param members     copies of the member alerts in arrival order
 * @param components  distinct resolved components of the members, first-seen order
 */
public record WindowSnapshot(
        String id,
        long sequence,
        IncidentStatus status,
        Instant windowStart,
        Instant windowEnd,
        List<Alert> members,
        Set<String> components,
        long revision) {

    public boolean isOpen() {
        return !status.isTerminal();
    }
}
