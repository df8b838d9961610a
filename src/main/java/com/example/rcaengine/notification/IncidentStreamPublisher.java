package com.example.rcaengine.notification;

import com.example.rcaengine.gateway.GatewayWebSocketHandler;
import com.example.rcaengine.model.IncidentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Incident stream: every incident change goes to the gateway sessions as an
 * {@code incident.updated} notification and, when configured, to the webhook.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentStreamPublisher {

    public static final String INCIDENT_UPDATED = "incident.updated";

    private final GatewayWebSocketHandler gateway;
    private final IncidentWebhookNotifier webhookNotifier;

    public void publish(IncidentEvent event) {
        if (event == null) return;
        log.debug("Incident {} -> {} (rev {}, {} alerts)", event.getIncidentId(), event.getStatus(),
                event.getRevision(), event.getMemberAlertIds().size());
        gateway.broadcast(INCIDENT_UPDATED, event);
        webhookNotifier.post(event);
    }
}
