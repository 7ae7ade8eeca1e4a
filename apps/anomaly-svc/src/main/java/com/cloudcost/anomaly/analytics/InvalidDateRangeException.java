package com.cloudcost.anomaly.analytics;

import java.time.LocalDate;

public class InvalidDateRangeException extends IllegalArgumentException {

    public InvalidDateRangeException(String startName, LocalDate start, String endName, LocalDate end) {
        super(startName + " (" + start + ") must be <= " + endName + " (" + end + ")");
    }

    static void requireOrdered(String startName, LocalDate start, String endName, LocalDate end) {
        if (start.isAfter(end)) {
            throw new InvalidDateRangeException(startName, start, endName, end);
        }
    }
}
