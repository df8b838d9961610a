package com.example.rcaengine.model;

/**
 * Reference to externally-owned diagnostic content (command, runbook,
 * dashboard). The engine stores only the reference.
 */
public record DiagnosticCheck(String id, String kind, String reference) {
}
