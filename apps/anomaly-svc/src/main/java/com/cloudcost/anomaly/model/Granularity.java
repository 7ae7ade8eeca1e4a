package com.cloudcost.anomaly.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * First day of the period containing {@code date}; weeks start on Monday.
     */
    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> date.withDayOfMonth(1);
        };
    }

    public static Granularity fromName(String name) {
        if (name == null || name.isBlank()) {
            return DAILY;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("granularity must be one of daily, weekly, monthly, got '" + name + "'");
        }
    }
}
