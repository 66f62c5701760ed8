package com.sashkomusic.catalogreconciler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationConfig {

    private int maxResults = 4;
    private double minScore = 0.25;
    private long requestDelayMs = 500;
    private Duration pendingSelectionTtl = Duration.ofHours(24);
    private Scoring scoring = new Scoring();

    @Data
    public static class Scoring {
        private double titleWeight = 0.5;
        private double artistWeight = 0.3;
        private double durationWeight = 0.2;
        private double durationToleranceSeconds = 5.0;
        private double durationCutoffSeconds = 30.0;
        private double neutralDurationScore = 0.7;
    }
}
