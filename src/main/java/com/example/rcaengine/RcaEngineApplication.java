package com.example.rcaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alert Correlation and Root-Cause Engine.
 *
 * Ingests a stream of monitoring alerts, groups related alerts into
 * incidents and infers the component most likely to have caused each group.
 *
 * Pipeline:
 * - Alert Normalizer → resolves the component of each alert from its labels
 * - Correlation Window Manager → temporal, topological and label matching
 * - Causal Graph Builder + Root-Cause Scorer → confidence-weighted hypothesis
 * - Investigation Path Generator → ordered diagnostic path for operators
 * - Incident Lifecycle Controller → open → investigating → identified → mitigated → resolved
 * - Gateway (WebSocket JSON-RPC) → incident stream for notifiers and UIs
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class RcaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RcaEngineApplication.class, args);
    }
}
