package com.example.rcaengine.memory;

import com.example.rcaengine.domain.RootCauseOutcome;
import com.example.rcaengine.repository.RootCauseOutcomeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RootCauseHistoryServiceTest {

    private RootCauseOutcomeRepository repository;
    private RootCauseHistoryService service;

    @BeforeEach
    void setUp() {
        repository = mock(RootCauseOutcomeRepository.class);
        service = new RootCauseHistoryService(repository);
    }

    @Test
    void rateIsConfirmedShareOfPastOutcomes() {
        when(repository.countByComponentIdAndAlertPattern("db-primary", "DbConnectionsExhausted")).thenReturn(4L);
        when(repository.countByComponentIdAndAlertPatternAndConfirmedTrue("db-primary", "DbConnectionsExhausted"))
                .thenReturn(3L);

        assertEquals(0.75, service.getRootCauseRate("db-primary", "DbConnectionsExhausted"));
    }

    @Test
    void rateIsCachedUntilNextOutcome() {
        when(repository.countByComponentIdAndAlertPattern("db-primary", "DbConnectionsExhausted")).thenReturn(2L);
        when(repository.countByComponentIdAndAlertPatternAndConfirmedTrue("db-primary", "DbConnectionsExhausted"))
                .thenReturn(1L);
        when(repository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        assertEquals(0.5, service.getRootCauseRate("db-primary", "DbConnectionsExhausted"));
        assertEquals(0.5, service.getRootCauseRate("db-primary", "DbConnectionsExhausted"));
        verify(repository, times(1)).countByComponentIdAndAlertPattern("db-primary", "DbConnectionsExhausted");

        when(repository.countByComponentIdAndAlertPattern("db-primary", "DbConnectionsExhausted")).thenReturn(3L);
        when(repository.countByComponentIdAndAlertPatternAndConfirmedTrue("db-primary", "DbConnectionsExhausted"))
                .thenReturn(2L);
        service.recordOutcome("INC-000002", Map.of("db-primary", "DbConnectionsExhausted"), "db-primary", null);

        assertEquals(2.0 / 3, service.getRootCauseRate("db-primary", "DbConnectionsExhausted"), 1e-9);
    }

    @Test
    void rateIsZeroWithoutHistory() {
        assertEquals(0.0, service.getRootCauseRate("api", "ApiLatencyHigh"));
    }

    @Test
    void fixReferencesAreDistinct() {
        when(repository.findConfirmedFixes("db-primary", "DbConnectionsExhausted")).thenReturn(List.of(
                RootCauseOutcome.builder().fixReference("CHG-2").build(),
                RootCauseOutcome.builder().fixReference("CHG-1").build(),
                RootCauseOutcome.builder().fixReference("CHG-2").build()));

        assertEquals(List.of("CHG-2", "CHG-1"), service.getFixReferences("db-primary", "DbConnectionsExhausted"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordOutcomeConfirmsOnlyTheRootCause() {
        when(repository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        Map<String, String> patterns = new TreeMap<>(Map.of(
                "api", "ApiLatencyHigh",
                "db-primary", "DbConnectionsExhausted"));

        List<RootCauseOutcome> saved = service.recordOutcome("INC-000001", patterns, "db-primary", "CHG-1042");

        ArgumentCaptor<List<RootCauseOutcome>> captor = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(captor.capture());
        assertEquals(2, saved.size());
        RootCauseOutcome api = captor.getValue().get(0);
        RootCauseOutcome db = captor.getValue().get(1);
        assertFalse(api.isConfirmed());
        assertNull(api.getFixReference());
        assertTrue(db.isConfirmed());
        assertEquals("CHG-1042", db.getFixReference());
        assertEquals("DbConnectionsExhausted", db.getAlertPattern());
        assertEquals("INC-000001", db.getIncidentId());
    }

    @Test
    void confirmedComponentMustHaveAlerted() {
        assertThrows(IllegalArgumentException.class, () ->
                service.recordOutcome("INC-000001", Map.of("api", "ApiLatencyHigh"), "db-primary", null));
        verify(repository, never()).saveAll(anyList());
    }
}
