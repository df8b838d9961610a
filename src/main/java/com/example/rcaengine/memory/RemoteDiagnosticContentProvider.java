package com.example.rcaengine.memory;

import com.example.rcaengine.config.EngineProperties;
import com.example.rcaengine.model.DiagnosticCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Fetches diagnostic checks from the runbook service at
 * {@code GET {base-url}/checks?component=..&pattern=..}, which answers with a
 * JSON array of {@code {id, kind, reference}}. Without a base URL no checks
 * are offered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteDiagnosticContentProvider implements DiagnosticContentProvider {

    private final WebClient webClient;
    private final EngineProperties properties;

    @Override
    public List<DiagnosticCheck> getChecks(String componentId, String alertPattern) {
        String baseUrl = properties.getLookup().getDiagnosticBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return List.of();
        }

        List<DiagnosticCheck> checks = webClient.get()
                .uri(baseUrl + "/checks?component={component}&pattern={pattern}", componentId, alertPattern)
                .retrieve()
                .bodyToFlux(DiagnosticCheck.class)
                .collectList()
                .block(Duration.ofMillis(properties.getLookup().getDiagnosticTimeoutMs()));

        log.debug("Fetched {} diagnostic checks for {} / {}", checks != null ? checks.size() : 0,
                componentId, alertPattern);
        return checks != null ? checks : List.of();
    }
}
