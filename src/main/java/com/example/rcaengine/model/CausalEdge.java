package com.example.rcaengine.model;

/**
 * One hop of inferred failure propagation: {@code from} failed first and
 * {@code to}, which depends on it, followed {@code delaySeconds} later.
 */
public record CausalEdge(String from, String to, long delaySeconds) {
}
