package com.example.rcaengine.topology;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current topology snapshot. Readers take the volatile snapshot
 * without locking; a sync builds the next snapshot and swaps it in under a
 * short exclusive lock, so in-flight correlation keeps the snapshot it started with.
 */
@Slf4j
@Component
public class TopologyStore {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile TopologySnapshot snapshot = TopologySnapshot.empty();

    public TopologySnapshot current() {
        return snapshot;
    }

    /**
     * An empty topology means correlation degrades to temporal and label matching.
     */
    public boolean isAvailable() {
        return !snapshot.isEmpty();
    }

    public TopologySnapshot replace(Collection<TopologyNode> nodes, Collection<TopologyEdge> edges) {
        writeLock.lock();
        try {
            TopologySnapshot next = TopologySnapshot.of(snapshot.getVersion() + 1, nodes, edges);
            snapshot = next;
            log.info("Topology snapshot v{} installed: {} components, {} dependencies",
                    next.getVersion(), next.nodes().size(), next.edges().size());
            return next;
        } finally {
            writeLock.unlock();
        }
    }
}
