package com.example.rcaengine.service;

import com.example.rcaengine.EngineFixtures;
import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.correlation.CorrelationWindow;
import com.example.rcaengine.correlation.CorrelationWindowManager;
import com.example.rcaengine.domain.AuditAction;
import com.example.rcaengine.model.CloseReason;
import com.example.rcaengine.model.IncidentEvent;
import com.example.rcaengine.model.IncidentStatus;
import com.example.rcaengine.notification.IncidentStreamPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Map;

import static com.example.rcaengine.EngineFixtures.T0;
import static com.example.rcaengine.EngineFixtures.alert;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WindowEvictionServiceTest {

    private CorrelationWindowManager manager;
    private IncidentStreamPublisher publisher;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        auditService = mock(AuditService.class);
        publisher = mock(IncidentStreamPublisher.class);
        manager = new CorrelationWindowManager(properties,
                EngineFixtures.store(EngineFixtures.chainTopology()),
                EngineFixtures.matchers(properties),
                Clock.fixed(T0, ZoneOffset.UTC), auditService);
    }

    private WindowEvictionService sweeperAt(Duration sinceT0) {
        return new WindowEvictionService(manager, publisher, auditService,
                Clock.fixed(T0.plus(sinceT0), ZoneOffset.UTC));
    }

    @Test
    void recentWindowSurvivesSweep() {
        manager.correlate(alert("fp-db", "db-primary", T0));

        sweeperAt(Duration.ofMinutes(10)).sweep();

        assertEquals(1, manager.open().size());
        verify(publisher, never()).publish(any());
    }

    @Test
    void idleWindowExpiresThenIsPurged() {
        CorrelationWindow window = manager.correlate(alert("fp-db", "db-primary", T0)).window();

        sweeperAt(Duration.ofMinutes(31)).sweep();

        assertEquals(IncidentStatus.RESOLVED, window.getStatus());
        ArgumentCaptor<IncidentEvent> event = ArgumentCaptor.forClass(IncidentEvent.class);
        verify(publisher).publish(event.capture());
        assertEquals(CloseReason.EXPIRED, event.getValue().getCloseReason());
        verify(auditService).log("system", AuditAction.WINDOW_EVICTED, window.getId(),
                Map.of("reason", "EXPIRED", "alerts", 1));
        assertTrue(manager.find(window.getId()).isPresent());

        sweeperAt(Duration.ofMinutes(62)).sweep();

        assertTrue(manager.find(window.getId()).isEmpty());
        assertEquals(0, manager.alertCount());
        verify(auditService).log(eq("system"), eq(AuditAction.WINDOW_EVICTED), eq(window.getId()), eq(Map.of("reason", "RETENTION")));
    }
}
