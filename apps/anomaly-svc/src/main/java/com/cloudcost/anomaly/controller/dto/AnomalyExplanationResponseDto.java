package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record AnomalyExplanationResponseDto(
        String service,
        LocalDate anomalyDate,
        String accountId,
        BaselineDto baseline,
        BigDecimal anomalyCost,
        BigDecimal costVsMedian,
        BigDecimal costMultiple,
        OngoingDto ongoing,
        boolean hasCurData,
        List<UsageTypeChangeDto> topUsageTypeChanges,
        String traceId
) {

    public record BaselineDto(BigDecimal median, BigDecimal min, BigDecimal max, boolean available) {
    }

    public record OngoingDto(boolean ongoing, int daysChecked, int elevatedDays) {
    }

    public record UsageTypeChangeDto(String usageType, BigDecimal baselineDailyCost, BigDecimal anomalyCost,
                                     BigDecimal absoluteChange, BigDecimal percentageChange) {
    }
}
