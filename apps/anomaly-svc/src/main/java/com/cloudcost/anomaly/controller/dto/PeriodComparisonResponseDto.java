package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record PeriodComparisonResponseDto(
        PeriodDto periodA,
        PeriodDto periodB,
        String groupBy,
        BigDecimal totalChange,
        List<EntryDto> movers,
        List<EntryDto> newInB,
        List<EntryDto> disappearedFromA,
        String traceId
) {

    public record PeriodDto(LocalDate start, LocalDate end, BigDecimal total) {
    }

    public record EntryDto(String groupValue, BigDecimal periodACost, BigDecimal periodBCost, BigDecimal absoluteChange, BigDecimal percentageChange) {
    }
}
