package com.cloudcost.anomaly.config;

import com.cloudcost.anomaly.model.DetectionParameters;
import com.cloudcost.anomaly.model.Sensitivity;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "costanomaly")
public record CostAnomalyProperties(
        Detection detection,
        Ingestion ingestion
) {

    @ConstructorBinding
    public CostAnomalyProperties {
        // both sections are optional; missing ones fall back to the built-in defaults
        if (detection == null) {
            detection = new Detection(null, null, null, null);
        }
        if (ingestion == null) {
            ingestion = new Ingestion(null);
        }
    }

    public record Detection(Integer windowDays, String sensitivity, Double minDailyCost, Double driftThresholdPct) {
        public Detection {
            if (windowDays == null) {
                windowDays = DetectionParameters.DEFAULT_WINDOW_DAYS;
            }
            if (windowDays < 1) {
                throw new IllegalArgumentException("windowDays must be >= 1, got " + windowDays);
            }
            if (sensitivity == null || sensitivity.isBlank()) {
                sensitivity = "medium";
            }
            if (minDailyCost == null) {
                minDailyCost = DetectionParameters.DEFAULT_MIN_DAILY_COST;
            }
            if (minDailyCost < 0) {
                throw new IllegalArgumentException("minDailyCost must be >= 0, got " + minDailyCost);
            }
            if (driftThresholdPct == null) {
                driftThresholdPct = DetectionParameters.DEFAULT_DRIFT_THRESHOLD * 100;
            }
            if (driftThresholdPct <= 0) {
                throw new IllegalArgumentException("driftThresholdPct must be positive, got " + driftThresholdPct);
            }
        }

        public Sensitivity sensitivityLevel() {
            return Sensitivity.fromName(sensitivity);
        }

        public double driftThresholdFraction() {
            return driftThresholdPct / 100.0d;
        }
    }

    public record Ingestion(List<String> excludedLineItemTypes) {
        public Ingestion {
            if (excludedLineItemTypes == null || excludedLineItemTypes.isEmpty()) {
                excludedLineItemTypes = List.of("Tax", "Fee", "Credit", "Refund", "BundledDiscount");
            }
            excludedLineItemTypes = List.copyOf(excludedLineItemTypes);
        }
    }
}
