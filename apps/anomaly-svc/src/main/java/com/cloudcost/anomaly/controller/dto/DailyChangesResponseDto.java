package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record DailyChangesResponseDto(
        Integer days,
        String groupBy,
        List<ChangeDto> changes,
        String traceId
) {

    public record ChangeDto(LocalDate usageDate, String groupValue, BigDecimal totalCost, BigDecimal costChange, BigDecimal pctChange) {
    }
}
