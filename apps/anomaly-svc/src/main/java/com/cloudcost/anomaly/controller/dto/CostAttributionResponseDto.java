package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record CostAttributionResponseDto(
        String service,
        String accountId,
        PeriodComparisonResponseDto.PeriodDto periodA,
        PeriodComparisonResponseDto.PeriodDto periodB,
        BigDecimal totalChange,
        BreakdownDto byUsageType,
        BreakdownDto byResource,
        String traceId
) {

    public record BreakdownDto(List<PeriodComparisonResponseDto.EntryDto> movers,
                               List<PeriodComparisonResponseDto.EntryDto> newInB,
                               List<PeriodComparisonResponseDto.EntryDto> disappearedFromA) {
    }
}
