package com.cloudcost.anomaly.model;

import java.time.LocalDate;
import java.util.List;

public record PointAnomaly(
        LocalDate usageDate,
        List<Dimension> groupBy,
        String groupValue,
        double currentCost,
        double medianCost,
        double mad,
        double zScore
) implements Anomaly {

    private static final double CRITICAL_Z = 4.0d;
    private static final double WARNING_Z = 3.0d;

    public PointAnomaly {
        groupBy = List.copyOf(groupBy);
    }

    @Override
    public Severity severity() {
        return classifySeverity(zScore);
    }

    @Override
    public Direction direction() {
        return zScore > 0 ? Direction.SPIKE : Direction.DROP;
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.POINT;
    }

    public static Severity classifySeverity(double zScore) {
        double magnitude = Math.abs(zScore);
        if (magnitude > CRITICAL_Z) {
            return Severity.CRITICAL;
        }
        if (magnitude > WARNING_Z) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }
}
