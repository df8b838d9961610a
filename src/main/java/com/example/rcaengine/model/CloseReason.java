package com.example.rcaengine.model;

public enum CloseReason {
    /** Every member alert reported resolved */
    ALERTS_RESOLVED,
    /** Operator closed the incident */
    FORCE_CLOSED,
    /** No correlated alert within the lookback */
    EXPIRED,
    /** Members were re-parented into another incident */
    MERGED
}
