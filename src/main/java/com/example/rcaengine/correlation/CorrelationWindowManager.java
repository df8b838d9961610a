package com.example.rcaengine.correlation;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.lifecycle.IllegalStateTransitionException;
import com.example.rcaengine.model.Alert;
import com.example.rcaengine.model.CloseReason;
import com.example.rcaengine.model.IncidentEvent;
import com.example.rcaengine.service.AuditService;
import com.example.rcaengine.topology.TopologySnapshot;
import com.example.rcaengine.topology.TopologyStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Correlation Window Manager - owns the map of live windows and decides
 * which window each alert joins.
 *
 * Matching reads window snapshots only. The chosen window is then locked,
 * re-validated and mutated; if it closed in the meantime the alert is
 * matched again. Alerts for unrelated windows never contend on a window lock.
 * Opening a window is serialized by the open lock, under which matching is
 * repeated, so two related alerts arriving together end up in one window.
 *
 * A resolved event for an alert no window knows is remembered for one
 * lookback; when its firing event shows up later the alert is admitted
 * already resolved.
 *
 * Candidate windows are the open windows whose end lies within the lookback
 * of the alert's start time, tried in creation order. Strategies are tried
 * in {@link MatchStrategy} order and the first match wins.
 */
@Slf4j
@Service
public class CorrelationWindowManager {

    static final int MAX_RESOLVED_AHEAD = 10_000;

    private final EngineProperties properties;
    private final TopologyStore topologyStore;
    private final List<WindowMatcher> matchers;
    private final Clock clock;
    private final AuditService auditService;

    private final Map<String, CorrelationWindow> windows = new ConcurrentHashMap<>();
    /** alert dedup key → id of the window owning the alert */
    private final Map<String, String> alertIndex = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock openLock = new ReentrantLock();
    /** alert dedup key → resolution time, for resolved events that arrived before their firing event */
    private final Cache<String, Instant> resolvedAhead = Caffeine.newBuilder()
            .maximumSize(MAX_RESOLVED_AHEAD)
            .build();

    public CorrelationWindowManager(EngineProperties properties,
                                    TopologyStore topologyStore,
                                    List<WindowMatcher> matchers,
                                    Clock clock,
                                    AuditService auditService) {
        this.properties = properties;
        this.topologyStore = topologyStore;
        this.matchers = matchers.stream()
                .sorted(Comparator.comparing(WindowMatcher::strategy))
                .toList();
        this.clock = clock;
        this.auditService = auditService;
    }

    /**
     * Place a firing alert into a window, opening one if nothing matches.
     */
    public CorrelationResult correlate(Alert alert) {
        TopologySnapshot topology = topologyStore.current();
        Instant resolvedEarly = resolvedAhead.asMap().remove(alert.dedupKey());
        if (resolvedEarly != null && alert.isFiring()) {
            alert.markResolved(resolvedEarly);
            log.info("Alert {} was resolved before it fired, admitting it resolved", alert.getId());
        }
        while (true) {
            String owner = alertIndex.get(alert.dedupKey());
            if (owner != null) {
                CorrelationWindow existing = windows.get(owner);
                if (existing != null) {
                    return new CorrelationResult(existing, CorrelationResult.Outcome.DUPLICATE, null, null);
                }
                alertIndex.remove(alert.dedupKey(), owner);
                continue;
            }

            CorrelationResult result = findMatch(alert, topology)
                    .map(m -> appendTo(m.window(), alert, m.strategy()))
                    .orElseGet(() -> matchOrOpen(alert, topology));
            if (result != null) {
                return result;
            }
            log.debug("Window for alert {} changed while matching, retrying", alert.getId());
        }
    }

    /**
     * Mark a member alert resolved. An alert no window has seen yet is
     * remembered so that its late firing event is admitted resolved.
     *
     * @return empty when no live window owns the alert
     */
    public Optional<CorrelationResult> resolveAlert(String dedupKey, String alertId, Instant resolvedAt) {
        String owner = alertIndex.get(dedupKey);
        if (owner == null) {
            resolvedAhead.put(dedupKey, resolvedAt != null ? resolvedAt : clock.instant());
            log.debug("Resolved event for unseen alert {} kept until its firing event", alertId);
            return Optional.empty();
        }
        CorrelationWindow window = windows.get(owner);
        if (window == null) return Optional.empty();

        try {
            return Optional.of(window.withLock(() -> {
                if (!window.resolveMember(alertId, resolvedAt)) {
                    return new CorrelationResult(window, CorrelationResult.Outcome.UNCHANGED, null, null);
                }
                return new CorrelationResult(window, CorrelationResult.Outcome.MEMBER_RESOLVED, null, window.toEvent());
            }));
        } catch (WindowStateCorruptedException e) {
            CorrelationWindow fresh = recreate(window, e);
            return Optional.of(fresh.withLock(() ->
                    new CorrelationResult(fresh, CorrelationResult.Outcome.MEMBER_RESOLVED, null, fresh.toEvent())));
        }
    }

    /**
     * Explicitly re-parent every member of {@code sourceId} into {@code targetId}.
     * The source is closed with reason MERGED.
     */
    public MergeResult merge(String targetId, String sourceId) {
        if (targetId.equals(sourceId)) {
            throw new IllegalArgumentException("Cannot merge an incident into itself: " + targetId);
        }
        CorrelationWindow target = require(targetId);
        CorrelationWindow source = require(sourceId);
        CorrelationWindow first = target.getSequence() < source.getSequence() ? target : source;
        CorrelationWindow second = first == target ? source : target;

        return first.withLock(() -> second.withLock(() -> {
            if (target.getStatus().isTerminal()) {
                throw new IllegalStateTransitionException(targetId, "Cannot merge into resolved incident " + targetId);
            }
            if (source.getStatus().isTerminal()) {
                throw new IllegalStateTransitionException(sourceId, "Cannot merge resolved incident " + sourceId);
            }
            List<Alert> moved = source.detach(source.members().stream().map(Alert::getId).toList());
            target.addAll(moved);
            for (Alert alert : moved) {
                alertIndex.put(alert.dedupKey(), targetId);
            }
            target.updateStorm(grace(), properties.getCorrelation().getStormThreshold());
            source.linkMergedInto(targetId);
            source.close(CloseReason.MERGED, clock.instant());
            log.info("Merged incident {} into {} ({} alerts re-parented)", sourceId, targetId, moved.size());
            return new MergeResult(target, target.toEvent(), source.toEvent(), moved.size());
        }));
    }

    /**
     * Open a new window holding the still-firing alerts of a resolved incident.
     * The resolved incident keeps its terminal state and points to the new one.
     */
    public ReopenResult reopen(String incidentId) {
        CorrelationWindow previous = require(incidentId);
        return previous.withLock(() -> {
            if (!previous.getStatus().isTerminal()) {
                throw new IllegalStateTransitionException(incidentId, "Incident " + incidentId + " is not resolved");
            }
            if (previous.getReopenedAs() != null) {
                throw new IllegalStateTransitionException(incidentId,
                        "Incident " + incidentId + " was already reopened as " + previous.getReopenedAs());
            }
            List<Alert> firing = previous.firingMembers();
            if (firing.isEmpty()) {
                throw new IllegalStateTransitionException(incidentId,
                        "Incident " + incidentId + " has no firing alerts to reopen");
            }

            Instant anchor = firing.stream().map(Alert::getStartedAt).min(Comparator.naturalOrder()).orElseThrow();
            CorrelationWindow fresh = newWindow(anchor);
            IncidentEvent freshEvent = fresh.withLock(() -> {
                previous.detach(firing.stream().map(Alert::getId).toList());
                fresh.addAll(firing);
                fresh.updateStorm(grace(), properties.getCorrelation().getStormThreshold());
                fresh.linkReopenedFrom(incidentId);
                for (Alert alert : firing) {
                    alertIndex.put(alert.dedupKey(), fresh.getId());
                }
                windows.put(fresh.getId(), fresh);
                return fresh.toEvent();
            });
            previous.linkReopenedAs(fresh.getId());
            log.info("Reopened incident {} as {} with {} firing alerts", incidentId, fresh.getId(), firing.size());
            return new ReopenResult(fresh, freshEvent, previous.toEvent());
        });
    }

    /**
     * Close open windows that saw no correlated alert within the lookback,
     * and forget early resolutions that are older than the lookback.
     */
    public List<IncidentEvent> expireStale(Instant now) {
        Instant horizon = now.minus(lookback());
        resolvedAhead.asMap().values().removeIf(resolvedAt -> resolvedAt.isBefore(horizon));
        List<IncidentEvent> expired = new ArrayList<>();
        for (CorrelationWindow window : all()) {
            WindowSnapshot snapshot = window.snapshot();
            if (!snapshot.isOpen() || !snapshot.windowEnd().isBefore(horizon)) continue;
            IncidentEvent event = window.withLock(() -> {
                WindowSnapshot current = window.snapshot();
                if (!current.isOpen() || !current.windowEnd().isBefore(horizon)) return null;
                window.close(CloseReason.EXPIRED, now);
                return window.toEvent();
            });
            if (event != null) {
                log.info("Expired incident {} (window end {})", window.getId(), snapshot.windowEnd());
                expired.add(event);
            }
        }
        return expired;
    }

    /**
     * Drop resolved windows, and the alerts they own, once past the retention period.
     *
     * @return ids of the dropped windows
     */
    public List<String> purgeResolved(Instant now) {
        Instant horizon = now.minus(Duration.ofMinutes(properties.getCorrelation().getTerminalRetentionMinutes()));
        List<String> purged = new ArrayList<>();
        for (CorrelationWindow window : all()) {
            if (!window.getStatus().isTerminal()) continue;
            Instant resolvedAt = window.getResolvedAt();
            if (resolvedAt == null || !resolvedAt.isBefore(horizon)) continue;
            window.withLock(() -> {
                window.members().forEach(alert -> alertIndex.remove(alert.dedupKey(), window.getId()));
                windows.remove(window.getId(), window);
                return null;
            });
            purged.add(window.getId());
        }
        if (!purged.isEmpty()) {
            log.info("Purged {} resolved incidents from the working set", purged.size());
        }
        return purged;
    }

    public Optional<CorrelationWindow> find(String incidentId) {
        return Optional.ofNullable(windows.get(incidentId));
    }

    public CorrelationWindow require(String incidentId) {
        return find(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    /** Windows in creation order. */
    public List<CorrelationWindow> all() {
        return windows.values().stream()
                .sorted(Comparator.comparingLong(CorrelationWindow::getSequence))
                .toList();
    }

    public List<CorrelationWindow> open() {
        return all().stream().filter(w -> !w.getStatus().isTerminal()).toList();
    }

    public Optional<String> ownerOf(String dedupKey) {
        return Optional.ofNullable(alertIndex.get(dedupKey));
    }

    public int alertCount() {
        return alertIndex.size();
    }

    /** Resolved events still waiting for their firing event. */
    public long pendingResolutions() {
        return resolvedAhead.asMap().size();
    }

    // ── internals ──

    private Optional<Match> findMatch(Alert alert, TopologySnapshot topology) {
        Instant horizon = alert.getStartedAt().minus(lookback());
        List<WindowSnapshot> candidates = windows.values().stream()
                .map(CorrelationWindow::snapshot)
                .filter(WindowSnapshot::isOpen)
                .filter(s -> !s.windowEnd().isBefore(horizon))
                .sorted(Comparator.comparingLong(WindowSnapshot::sequence))
                .toList();

        for (WindowMatcher matcher : matchers) {
            for (WindowSnapshot candidate : candidates) {
                if (matcher.matches(alert, candidate, topology)) {
                    CorrelationWindow window = windows.get(candidate.id());
                    if (window != null) {
                        log.debug("Alert {} matched {} by {}", alert.getId(), candidate.id(), matcher.strategy());
                        return Optional.of(new Match(window, matcher.strategy()));
                    }
                }
            }
        }
        return Optional.empty();
    }

    /** @return null when the window closed or was replaced before the lock was taken */
    private CorrelationResult appendTo(CorrelationWindow window, Alert alert, MatchStrategy strategy) {
        try {
            return window.withLock(() -> {
                if (windows.get(window.getId()) != window || window.getStatus().isTerminal()) {
                    return null;
                }
                if (alertIndex.putIfAbsent(alert.dedupKey(), window.getId()) != null) {
                    return null;
                }
                window.add(alert);
                window.updateStorm(grace(), properties.getCorrelation().getStormThreshold());
                return new CorrelationResult(window, CorrelationResult.Outcome.APPENDED, strategy, window.toEvent());
            });
        } catch (WindowStateCorruptedException e) {
            CorrelationWindow fresh = recreate(window, e);
            return fresh.withLock(() -> {
                fresh.updateStorm(grace(), properties.getCorrelation().getStormThreshold());
                return new CorrelationResult(fresh, CorrelationResult.Outcome.APPENDED, strategy, fresh.toEvent());
            });
        }
    }

    /**
     * Slow path once matching found nothing: repeat the match under the open
     * lock, so a window opened meanwhile by a related alert is joined.
     */
    private CorrelationResult matchOrOpen(Alert alert, TopologySnapshot topology) {
        openLock.lock();
        try {
            return findMatch(alert, topology)
                    .map(m -> appendTo(m.window(), alert, m.strategy()))
                    .orElseGet(() -> openWindow(alert));
        } finally {
            openLock.unlock();
        }
    }

    private CorrelationResult openWindow(Alert alert) {
        CorrelationWindow window = newWindow(alert.getStartedAt());
        return window.withLock(() -> {
            if (alertIndex.putIfAbsent(alert.dedupKey(), window.getId()) != null) {
                return null;
            }
            window.add(alert);
            window.updateStorm(grace(), properties.getCorrelation().getStormThreshold());
            windows.put(window.getId(), window);
            log.info("Opened incident {} for alert {} ({}, component={})",
                    window.getId(), alert.getId(), alert.getName(), alert.getComponentId());
            return new CorrelationResult(window, CorrelationResult.Outcome.OPENED, null, window.toEvent());
        });
    }

    private CorrelationWindow newWindow(Instant anchor) {
        long seq = sequence.incrementAndGet();
        return new CorrelationWindow(String.format("INC-%06d", seq), seq, anchor, clock.instant(), 0);
    }

    /**
     * Replace a corrupted window by a rebuilt copy under the same id.
     */
    private CorrelationWindow recreate(CorrelationWindow broken, WindowStateCorruptedException cause) {
        log.error("Recreating incident {}: {}", broken.getId(), cause.getMessage());
        return broken.withLock(() -> {
            CorrelationWindow fresh = CorrelationWindow.rebuild(broken);
            windows.put(fresh.getId(), fresh);
            auditService.log("system", AuditAction.WINDOW_RECREATED, fresh.getId(),
                    Map.of("reason", String.valueOf(cause.getMessage()), "members", fresh.snapshot().members().size()));
            return fresh;
        });
    }

    private Duration grace() {
        return Duration.ofMinutes(properties.getCorrelation().getGracePeriodMinutes());
    }

    private Duration lookback() {
        return Duration.ofMinutes(properties.getCorrelation().getLookbackMinutes());
    }

    private record Match(CorrelationWindow window, MatchStrategy strategy) {
    }

    public record MergeResult(CorrelationWindow target, IncidentEvent targetEvent, IncidentEvent sourceEvent,
                              int movedAlerts) {
    }

    public record ReopenResult(CorrelationWindow window, IncidentEvent event, IncidentEvent previousEvent) {
    }
}
