package com.example.rcaengine.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncidentPriorityTest {

    @Test
    void priorityFollowsSeverity() {
        assertEquals(IncidentPriority.P1, IncidentPriority.of(Severity.CRITICAL, false));
        assertEquals(IncidentPriority.P2, IncidentPriority.of(Severity.HIGH, false));
        assertEquals(IncidentPriority.P3, IncidentPriority.of(Severity.WARNING, false));
        assertEquals(IncidentPriority.P4, IncidentPriority.of(Severity.INFO, false));
    }

    @Test
    void stormRaisesPriorityOneLevel() {
        assertEquals(IncidentPriority.P2, IncidentPriority.of(Severity.WARNING, true));
        assertEquals(IncidentPriority.P3, IncidentPriority.of(Severity.INFO, true));
        assertEquals(IncidentPriority.P1, IncidentPriority.of(Severity.CRITICAL, true));
    }

    @Test
    void highestSeverityIsMostSevere() {
        assertEquals(Severity.CRITICAL, Severity.highest(List.of(Severity.INFO, Severity.CRITICAL, Severity.HIGH)));
        assertEquals(Severity.INFO, Severity.highest(List.of()));
    }
}
