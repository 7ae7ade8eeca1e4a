package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record CostDrillDownResponseDto(
        String service,
        LocalDate dateStart,
        LocalDate dateEnd,
        String accountId,
        BigDecimal totalCost,
        long lineItemCount,
        List<ShareDto> byUsageType,
        List<ShareDto> byOperation,
        List<ShareDto> topResources,
        String traceId
) {

    public record ShareDto(String key, BigDecimal cost, BigDecimal percentageOfTotal, BigDecimal usageAmount) {
    }
}
