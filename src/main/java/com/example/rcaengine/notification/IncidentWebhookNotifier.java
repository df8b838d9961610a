package com.example.rcaengine.notification;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.model.IncidentEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Posts incident events to the configured webhook. Runs on the
 * notification pool, so slow receivers never hold up correlation;
 * receivers order events by their revision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentWebhookNotifier {

    private static final MediaType JSON = MediaType.get("application/json");

    private final EngineProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public boolean isEnabled() {
        EngineProperties.NotificationConfig.WebhookConfig webhook = properties.getNotifications().getWebhook();
        return webhook.isEnabled() && webhook.getUrl() != null && !webhook.getUrl().isBlank();
    }

    @Async("notificationExecutor")
    public void post(IncidentEvent event) {
        if (!isEnabled()) return;

        try {
            String json = objectMapper.writeValueAsString(event);
            Request request = new Request.Builder()
                    .url(properties.getNotifications().getWebhook().getUrl())
                    .post(RequestBody.create(json, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Webhook notified for incident {} rev {}", event.getIncidentId(), event.getRevision());
                } else {
                    log.warn("Webhook rejected incident {} rev {}: HTTP {}",
                            event.getIncidentId(), event.getRevision(), response.code());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to notify webhook for incident {}: {}", event.getIncidentId(), e.getMessage());
        }
    }
}
