package com.cloudcost.anomaly.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record ScanResponseDto(
        LocalDate scanStart,
        LocalDate scanEnd,
        Integer daysScanned,
        String groupBy,
        Integer count,
        List<AnomalyResponseDto> anomalies,
        String traceId
) {
}
