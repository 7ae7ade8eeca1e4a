package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AnomalyResponseDto(
        LocalDate usageDate,
        String groupBy,
        String groupValue,
        BigDecimal currentCost,
        BigDecimal medianCost,
        BigDecimal mad,
        double zScore,
        String severity,
        String direction,
        String kind
) {
}
