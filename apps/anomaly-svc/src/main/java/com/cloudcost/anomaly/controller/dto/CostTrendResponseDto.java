package com.cloudcost.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record CostTrendResponseDto(
        LocalDate dateStart,
        LocalDate dateEnd,
        String granularity,
        String groupBy,
        String filterValue,
        SummaryDto summary,
        List<PointDto> points,
        String traceId
) {

    public record SummaryDto(BigDecimal total, BigDecimal average, BigDecimal min, BigDecimal max, Integer periods) {
    }

    public record PointDto(LocalDate period, String groupValue, BigDecimal cost) {
    }
}
