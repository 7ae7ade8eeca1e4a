package com.cloudcost.anomaly.controller.dto;

public record LineItemsIngestResponseDto(Integer rowsLoaded, Integer rowsReplaced, Integer summaryRows, String traceId) {
}
