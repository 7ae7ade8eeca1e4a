package com.cloudcost.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * A single billing line item. Usage timestamps are UTC.
 */
public record LineItem(
        String lineItemId,
        LocalDateTime usageStartDate,
        String payerAccountId,
        String usageAccountId,
        String productCode,
        String region,
        String usageType,
        String operation,
        String resourceId,
        String lineItemType,
        BigDecimal unblendedCost,
        BigDecimal netAmortizedCost,
        BigDecimal usageAmount,
        String currencyCode,
        String dataSource
) {

    public static final String SOURCE_CUR = "cur";
    public static final String SOURCE_COST_EXPLORER = "cost_explorer";
    public static final Set<String> DATA_SOURCES = Set.of(SOURCE_CUR, SOURCE_COST_EXPLORER);

    public LineItem {
        if (usageStartDate == null) {
            throw new IllegalArgumentException("usageStartDate must be provided");
        }
        if (lineItemType == null || lineItemType.isBlank()) {
            throw new IllegalArgumentException("lineItemType must be provided");
        }
        if (unblendedCost == null) {
            throw new IllegalArgumentException("unblendedCost must be provided");
        }
        if (dataSource == null || dataSource.isBlank()) {
            dataSource = SOURCE_CUR;
        }
        if (!DATA_SOURCES.contains(dataSource)) {
            throw new IllegalArgumentException("dataSource must be one of " + DATA_SOURCES + ", got '" + dataSource + "'");
        }
    }
}
