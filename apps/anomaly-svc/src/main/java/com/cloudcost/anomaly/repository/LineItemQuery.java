package com.cloudcost.anomaly.repository;

import java.time.LocalDate;

/**
 * Line items of one service between two inclusive usage dates, optionally for one account.
 */
public record LineItemQuery(String productCode, String accountId, LocalDate start, LocalDate end) {

    public LineItemQuery {
        if (productCode == null || productCode.isBlank()) {
            throw new IllegalArgumentException("service must be provided");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must be provided");
        }
        if (accountId != null && accountId.isBlank()) {
            accountId = null;
        }
    }

    public LineItemQuery withDates(LocalDate newStart, LocalDate newEnd) {
        return new LineItemQuery(productCode, accountId, newStart, newEnd);
    }
}
