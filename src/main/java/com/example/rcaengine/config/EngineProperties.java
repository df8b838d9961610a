package com.example.rcaengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the correlation engine.
 * Maps to the 'rca-engine' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rca-engine")
public class EngineProperties {

    private CorrelationConfig correlation = new CorrelationConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private InvestigationConfig investigation = new InvestigationConfig();
    private LookupConfig lookup = new LookupConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private EvictionConfig eviction = new EvictionConfig();
    private GatewayConfig gateway = new GatewayConfig();

    @Data
    public static class CorrelationConfig {
        /** Also the width by which a window slides past its last alert */
        private int gracePeriodMinutes = 5;
        private int lookbackMinutes = 30;
        private int maxHops = 2;
        /** Labels whose shared value links an alert to a window (same deployment, host, pod...) */
        private List<String> correlatingLabels = new ArrayList<>(List.of("deployment", "host", "pod"));
        private int stormThreshold = 3;
        /** Number of single-threaded lanes alerts are partitioned into by component */
        private int orderingLanes = 8;
        private int terminalRetentionMinutes = 30;
    }

    @Data
    public static class ScoringConfig {
        private double minConfidence = 0.5;
        private double dependencyDecay = 0.25;
        private WeightsConfig weights = new WeightsConfig();

        @Data
        public static class WeightsConfig {
            private String version = "v1";
            private double time = 0.30;
            private double dependency = 0.25;
            private double historical = 0.25;
            private double criticality = 0.20;
        }
    }

    @Data
    public static class InvestigationConfig {
        private int maxSteps = 5;
    }

    @Data
    public static class LookupConfig {
        private long historicalTimeoutMs = 250;
        private long diagnosticTimeoutMs = 500;
        private String diagnosticBaseUrl = "";
    }

    @Data
    public static class NotificationConfig {
        private WebhookConfig webhook = new WebhookConfig();

        @Data
        public static class WebhookConfig {
            private boolean enabled = false;
            private String url = "";
        }
    }

    @Data
    public static class EvictionConfig {
        private int intervalSeconds = 60;
    }

    @Data
    public static class GatewayConfig {
        private String path = "/ws/gateway";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
