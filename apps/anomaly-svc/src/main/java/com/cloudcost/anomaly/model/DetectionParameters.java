package com.cloudcost.anomaly.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Caller-supplied knobs for one detection run. {@code dataSource} and {@code referenceDate} are
 * optional; a null reference date means "today" as seen by the detector's clock.
 */
public record DetectionParameters(
        int windowDays,
        List<Dimension> groupBy,
        Sensitivity sensitivity,
        double minDailyCost,
        double driftThreshold,
        String dataSource,
        LocalDate referenceDate
) {

    public static final int DEFAULT_WINDOW_DAYS = 14;
    public static final double DEFAULT_MIN_DAILY_COST = 1.0d;
    public static final double DEFAULT_DRIFT_THRESHOLD = 0.20d;

    public DetectionParameters {
        if (groupBy == null || groupBy.isEmpty()) {
            throw new InvalidGroupingException("group_by must name at least one dimension");
        }
        groupBy = List.copyOf(groupBy);
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1");
        }
        if (minDailyCost < 0) {
            throw new IllegalArgumentException("minDailyCost must be >= 0");
        }
        if (driftThreshold <= 0) {
            throw new IllegalArgumentException("driftThreshold must be positive");
        }
        if (sensitivity == null) {
            sensitivity = Sensitivity.MEDIUM;
        }
        if (dataSource != null && dataSource.isBlank()) {
            dataSource = null;
        }
    }

    public DetectionParameters withReferenceDate(LocalDate date) {
        return new DetectionParameters(windowDays, groupBy, sensitivity, minDailyCost, driftThreshold, dataSource, date);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int windowDays = DEFAULT_WINDOW_DAYS;
        private List<Dimension> groupBy = List.of(Dimension.SERVICE);
        private Sensitivity sensitivity = Sensitivity.MEDIUM;
        private double minDailyCost = DEFAULT_MIN_DAILY_COST;
        private double driftThreshold = DEFAULT_DRIFT_THRESHOLD;
        private String dataSource;
        private LocalDate referenceDate;

        public Builder windowDays(int windowDays) {
            this.windowDays = windowDays;
            return this;
        }

        public Builder groupBy(List<Dimension> groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder groupBy(Dimension... groupBy) {
            this.groupBy = List.of(groupBy);
            return this;
        }

        public Builder sensitivity(Sensitivity sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder minDailyCost(double minDailyCost) {
            this.minDailyCost = minDailyCost;
            return this;
        }

        public Builder driftThreshold(double driftThreshold) {
            this.driftThreshold = driftThreshold;
            return this;
        }

        public Builder dataSource(String dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder referenceDate(LocalDate referenceDate) {
            this.referenceDate = referenceDate;
            return this;
        }

        public DetectionParameters build() {
            return new DetectionParameters(windowDays, groupBy, sensitivity, minDailyCost, driftThreshold, dataSource, referenceDate);
        }
    }
}
