package com.cloudcost.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record CostTrend(
        LocalDate dateStart,
        LocalDate dateEnd,
        Granularity granularity,
        Dimension groupBy,
        String filterValue,
        List<Point> points,
        BigDecimal total,
        BigDecimal average,
        BigDecimal minCost,
        BigDecimal maxCost
) {

    public record Point(LocalDate periodStart, String groupValue, BigDecimal cost) {
    }

    /**
     * Day-over-day movement of one group; the change fields are null on a group's first day and
     * the percentage is null when the previous day cost nothing.
     */
    public record DailyChange(LocalDate usageDate, String groupValue, BigDecimal totalCost, BigDecimal costChange, BigDecimal pctChange) {
    }
}
