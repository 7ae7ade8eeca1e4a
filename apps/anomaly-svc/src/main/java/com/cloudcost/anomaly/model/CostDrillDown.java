package com.cloudcost.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Where one service's cost went over a date range, by usage type, operation and resource.
 */
public record CostDrillDown(
        String service,
        LocalDate dateStart,
        LocalDate dateEnd,
        String accountId,
        BigDecimal totalCost,
        long lineItemCount,
        List<Share> byUsageType,
        List<Share> byOperation,
        List<Share> topResources
) {

    public CostDrillDown {
        byUsageType = List.copyOf(byUsageType);
        byOperation = List.copyOf(byOperation);
        topResources = List.copyOf(topResources);
    }

    public record Share(String key, BigDecimal cost, BigDecimal percentageOfTotal, BigDecimal usageAmount) {
    }
}
