package com.example.rcaengine.domain;

/**
 * Kinds of audited window and lifecycle actions.
 */
public enum AuditAction {
    WINDOW_OPENED,
    ALERT_CORRELATED,
    WINDOWS_MERGED,
    INCIDENT_TRANSITION,
    /** Expired idle window, or resolved window dropped after retention */
    WINDOW_EVICTED,
    /** Window rebuilt after its state was found corrupted */
    WINDOW_RECREATED,
    ROOT_CAUSE_CONFIRMED,
    TOPOLOGY_SYNCED
}
