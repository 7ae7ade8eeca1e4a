package com.cloudcost.anomaly.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Gradual drift across the detection window. {@code driftFraction} of 1.0 means the fitted slope
 * moves cost by 100% of the baseline median over the window.
 */
public record TrendAnomaly(
        LocalDate usageDate,
        List<Dimension> groupBy,
        String groupValue,
        double currentCost,
        double medianCost,
        double mad,
        double driftFraction
) implements Anomaly {

    private static final double CRITICAL_DRIFT = 1.0d;
    private static final double WARNING_DRIFT = 0.5d;

    public TrendAnomaly {
        groupBy = List.copyOf(groupBy);
    }

    @Override
    public double zScore() {
        return driftFraction;
    }

    @Override
    public Severity severity() {
        return classifySeverity(driftFraction);
    }

    @Override
    public Direction direction() {
        return driftFraction > 0 ? Direction.DRIFT_UP : Direction.DRIFT_DOWN;
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.TREND;
    }

    public static Severity classifySeverity(double driftFraction) {
        double magnitude = Math.abs(driftFraction);
        if (magnitude > CRITICAL_DRIFT) {
            return Severity.CRITICAL;
        }
        if (magnitude > WARNING_DRIFT) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }
}
