package com.cloudcost.anomaly.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record AnomaliesListResponseDto(
        LocalDate referenceDate,
        Integer windowDays,
        String groupBy,
        String sensitivity,
        Integer count,
        List<AnomalyResponseDto> anomalies,
        String traceId
) {
}
