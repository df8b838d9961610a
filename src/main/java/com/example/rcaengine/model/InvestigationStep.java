package com.example.rcaengine.model;

import java.util.List;

public record InvestigationStep(
        int order,
        String componentId,
        double probability,
        List<DiagnosticCheck> checks,
        List<String> historicalFixRefs) {
}
