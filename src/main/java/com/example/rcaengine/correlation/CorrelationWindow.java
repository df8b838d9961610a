package com.example.rcaengine.correlation;

import com.example.rcaengine.lifecycle.IllegalStateTransitionException;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.CloseReason;
import com.example.rcaengine.model.IncidentEvent;
import com.example.rcaengine.model.IncidentPriority;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.model.IncidentView;
import com.example.rcaengine.model.RootCauseHypothesis;
import com.example.rcaengine.model.Severity;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A correlation window, which is also the incident it grows into.
 *
 * All mutators require the window lock to be held by the caller (see
 * {@link #withLock(Supplier)}); every mutation republishes the immutable
 * {@link WindowSnapshot}. The revision increases on each membership or
 * member-status change and gates which hypothesis may be applied.
 */
public class CorrelationWindow {

    static final String INSTANCE_LABEL = "instance";
    static final int MAX_LISTED_INSTANCES = 10;

    @Getter
    private final String id;
    @Getter
    private final long sequence;
    @Getter
    private final Instant createdAt;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Alert> members = new LinkedHashMap<>();

    private Instant windowStart;
    private Instant windowEnd;
    private IncidentStatus status = IncidentStatus.OPEN;
    private CloseReason closeReason;
    private RootCauseHypothesis rootCause;
    private long revision;
    private boolean storm;

    private Instant acknowledgedAt;
    private Instant identifiedAt;
    private Instant mitigatedAt;
    private Instant resolvedAt;

    private String mergedInto;
    private String reopenedFrom;
    private String reopenedAs;

    private volatile WindowSnapshot snapshot;

    CorrelationWindow(String id, long sequence, Instant anchor, Instant createdAt, long initialRevision) {
        this.id = id;
        this.sequence = sequence;
        this.createdAt = createdAt;
        this.windowStart = anchor;
        this.windowEnd = anchor;
        this.revision = initialRevision;
        this.snapshot = buildSnapshot();
    }

    /**
     * Copy of a window whose bookkeeping is corrupted: same id, members and
     * lifecycle state, revision restarted and hypothesis dropped so that it
     * is recomputed. Caller holds the lock of {@code broken}.
     */
    static CorrelationWindow rebuild(CorrelationWindow broken) {
        broken.requireLock();
        CorrelationWindow fresh = new CorrelationWindow(broken.id, broken.sequence, broken.windowStart,
                broken.createdAt, 0);
        fresh.members.putAll(broken.members);
        fresh.windowStart = broken.windowStart;
        fresh.windowEnd = broken.windowEnd;
        fresh.status = broken.status;
        fresh.closeReason = broken.closeReason;
        fresh.storm = broken.storm;
        fresh.acknowledgedAt = broken.acknowledgedAt;
        fresh.identifiedAt = broken.identifiedAt;
        fresh.mitigatedAt = broken.mitigatedAt;
        fresh.resolvedAt = broken.resolvedAt;
        fresh.mergedInto = broken.mergedInto;
        fresh.reopenedFrom = broken.reopenedFrom;
        fresh.reopenedAs = broken.reopenedAs;
        fresh.revision = 1;
        fresh.publish();
        return fresh;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public WindowSnapshot snapshot() {
        return snapshot;
    }

    // ── membership ──

    void add(Alert alert) {
        requireLock();
        members.put(alert.getId(), alert);
        if (alert.getStartedAt().isAfter(windowEnd)) windowEnd = alert.getStartedAt();
        if (alert.getStartedAt().isBefore(windowStart)) windowStart = alert.getStartedAt();
        bumpRevision();
    }

    void addAll(Collection<Alert> alerts) {
        requireLock();
        for (Alert alert : alerts) {
            add(alert);
        }
    }

    /** Detach every member; only used by explicit merge and reopen. */
    List<Alert> detach(Collection<String> alertIds) {
        requireLock();
        List<Alert> detached = new ArrayList<>();
        for (String alertId : alertIds) {
            Alert removed = members.remove(alertId);
            if (removed != null) detached.add(removed);
        }
        if (!detached.isEmpty()) bumpRevision();
        return detached;
    }

    /**
     * Mark a member resolved. Counts as a window change because resolved
     * components drop out of the causal graph.
     */
    boolean resolveMember(String alertId, Instant resolvedAt) {
        requireLock();
        Alert alert = members.get(alertId);
        if (alert == null || !alert.isFiring()) return false;
        alert.markResolved(resolvedAt);
        bumpRevision();
        return true;
    }

    void updateStorm(Duration grace, int threshold) {
        requireLock();
        storm = StormDetector.isStorm(members.values(), grace, threshold);
        publish();
    }

    public boolean allMembersResolved() {
        requireLock();
        return !members.isEmpty() && members.values().stream().noneMatch(Alert::isFiring);
    }

    public List<Alert> firingMembers() {
        requireLock();
        return members.values().stream().filter(Alert::isFiring).toList();
    }

    public List<Alert> members() {
        requireLock();
        return List.copyOf(members.values());
    }

    // ── hypothesis ──

    /**
     * Install a hypothesis if it was computed against the current revision.
     *
     * @return false when a newer revision exists and the hypothesis is stale
     */
    public boolean applyHypothesis(RootCauseHypothesis hypothesis) {
        requireLock();
        if (hypothesis.getRevision() != revision || status.isTerminal()) {
            return false;
        }
        rootCause = hypothesis;
        publish();
        return true;
    }

    public RootCauseHypothesis getRootCause() {
        requireLock();
        return rootCause;
    }

    // ── lifecycle ──

    public IncidentStatus getStatus() {
        return snapshot.status();
    }

    public void transitionTo(IncidentStatus target, Instant at) {
        requireLock();
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateTransitionException(id, status, target);
        }
        status = target;
        switch (target) {
            case INVESTIGATING -> acknowledgedAt = at;
            case IDENTIFIED -> identifiedAt = at;
            case MITIGATED -> mitigatedAt = at;
            case RESOLVED -> resolvedAt = at;
            default -> { }
        }
        publish();
    }

    public void close(CloseReason reason, Instant at) {
        requireLock();
        transitionTo(IncidentStatus.RESOLVED, at);
        closeReason = reason;
        publish();
    }

    void linkMergedInto(String targetId) {
        requireLock();
        mergedInto = targetId;
        publish();
    }

    void linkReopenedFrom(String previousId) {
        requireLock();
        reopenedFrom = previousId;
        publish();
    }

    String getReopenedAs() {
        requireLock();
        return reopenedAs;
    }

    void linkReopenedAs(String nextId) {
        requireLock();
        reopenedAs = nextId;
        publish();
    }

    public Instant getResolvedAt() {
        return withLock(() -> resolvedAt);
    }

    public long getRevision() {
        return snapshot.revision();
    }

    // ── read models ──

    public IncidentEvent toEvent() {
        requireLock();
        Severity severity = severity();
        List<String> instances = instances();
        return IncidentEvent.builder()
                .incidentId(id)
                .status(status)
                .memberAlertIds(List.copyOf(members.keySet()))
                .affectedComponents(List.copyOf(affectedComponents()))
                .rootCause(rootCause)
                .storm(storm)
                .severity(severity)
                .priority(IncidentPriority.of(severity, storm))
                .summary(summary())
                .commonLabels(commonLabels())
                .affectedInstances(instances.stream().limit(MAX_LISTED_INSTANCES).toList())
                .instanceCount(instances.size())
                .revision(revision)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .closeReason(closeReason)
                .mergedInto(mergedInto)
                .reopenedFrom(reopenedFrom)
                .build();
    }

    public IncidentView toView() {
        requireLock();
        Severity severity = severity();
        List<String> instances = instances();
        return IncidentView.builder()
                .id(id)
                .status(status)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .alerts(List.copyOf(members.values()))
                .affectedComponents(List.copyOf(affectedComponents()))
                .rootCause(rootCause)
                .storm(storm)
                .severity(severity)
                .priority(IncidentPriority.of(severity, storm))
                .summary(summary())
                .commonLabels(commonLabels())
                .affectedInstances(instances.stream().limit(MAX_LISTED_INSTANCES).toList())
                .instanceCount(instances.size())
                .revision(revision)
                .closeReason(closeReason)
                .mergedInto(mergedInto)
                .reopenedFrom(reopenedFrom)
                .reopenedAs(reopenedAs)
                .createdAt(createdAt)
                .acknowledgedAt(acknowledgedAt)
                .identifiedAt(identifiedAt)
                .mitigatedAt(mitigatedAt)
                .resolvedAt(resolvedAt)
                .timeToAcknowledgeSeconds(secondsSinceCreation(acknowledgedAt))
                .timeToIdentifySeconds(secondsSinceCreation(identifiedAt))
                .timeToResolveSeconds(secondsSinceCreation(resolvedAt))
                .build();
    }

    private Long secondsSinceCreation(Instant at) {
        return at == null ? null : Duration.between(createdAt, at).getSeconds();
    }

    private Severity severity() {
        return Severity.highest(members.values().stream().map(Alert::getSeverity).toList());
    }

    /** Component, instance and name of the earliest-arriving member. */
    private String summary() {
        if (members.isEmpty()) return "No member alerts";
        Alert first = members.values().iterator().next();
        String summary = "Issue on " + first.getLabels().getOrDefault(INSTANCE_LABEL, "unknown")
                + " - " + first.getName();
        if (first.hasComponent()) summary = first.getComponentId() + ": " + summary;
        if (members.size() > 1) summary += " (+" + (members.size() - 1) + " related)";
        return summary;
    }

    private Map<String, String> commonLabels() {
        Map<String, String> common = null;
        for (Alert alert : members.values()) {
            if (common == null) {
                common = new TreeMap<>(alert.getLabels());
            } else {
                common.entrySet().removeIf(e -> !Objects.equals(e.getValue(), alert.getLabels().get(e.getKey())));
            }
        }
        return common == null ? Map.of() : Collections.unmodifiableMap(common);
    }

    private List<String> instances() {
        Set<String> instances = new LinkedHashSet<>();
        for (Alert alert : members.values()) {
            String instance = alert.getLabels().get(INSTANCE_LABEL);
            if (instance != null) instances.add(instance);
        }
        return List.copyOf(instances);
    }

    private Set<String> affectedComponents() {
        Set<String> components = new LinkedHashSet<>();
        for (Alert alert : members.values()) {
            if (alert.hasComponent()) components.add(alert.getComponentId());
        }
        return components;
    }

    private void bumpRevision() {
        if (revision == Long.MAX_VALUE) {
            throw new WindowStateCorruptedException(id, "Revision counter overflow on window " + id);
        }
        revision++;
        publish();
    }

    private void publish() {
        snapshot = buildSnapshot();
    }

    private WindowSnapshot buildSnapshot() {
        return new WindowSnapshot(id, sequence, status, windowStart, windowEnd,
                members.values().stream().map(Alert::copy).toList(),
                Collections.unmodifiableSet(affectedComponents()), revision);
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Window " + id + " mutated without holding its lock");
        }
    }
}
