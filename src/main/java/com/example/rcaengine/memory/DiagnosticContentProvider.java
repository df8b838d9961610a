package com.example.rcaengine.memory;

import com.example.rcaengine.model.DiagnosticCheck;

import java.util.List;

/**
 * Source of diagnostic checks (commands, runbooks, dashboards) for a
 * component and alert pattern. Callers go through {@link BoundedLookup}.
 */
public interface DiagnosticContentProvider {

    List<DiagnosticCheck> getChecks(String componentId, String alertPattern);
}
