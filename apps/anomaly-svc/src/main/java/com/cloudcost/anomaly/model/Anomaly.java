package com.cloudcost.anomaly.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * A detected cost anomaly for one group on one day.
 *
 * <p>{@link #zScore()} is a modified z-score for {@link PointAnomaly} and a fractional drift for
 * {@link TrendAnomaly}. The two values live on different scales and must never be compared with
 * each other; {@link #RANKING} orders by severity tier first for that reason.
 */
public interface Anomaly {

    Comparator<Anomaly> RANKING = Comparator
            .comparingInt((Anomaly anomaly) -> anomaly.severity().rank())
            .thenComparing(anomaly -> Math.abs(anomaly.zScore()), Comparator.reverseOrder());

    LocalDate usageDate();

    List<Dimension> groupBy();

    String groupValue();

    double currentCost();

    double medianCost();

    double mad();

    double zScore();

    Severity severity();

    Direction direction();

    AnomalyKind kind();

    default String groupByLabel() {
        return Dimension.label(groupBy());
    }

    /**
     * Identity of a detection across consecutive scan days.
     */
    default StreakKey streakKey() {
        return new StreakKey(groupValue(), kind());
    }

    record StreakKey(String groupValue, AnomalyKind kind) {
    }
}
