package com.cloudcost.anomaly.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import java.time.LocalDateTime;

public record LineItemRequestDto(
        String lineItemId,
        @NotNull LocalDateTime usageStartDate,
        String payerAccountId,
        String usageAccountId,
        String productCode,
        String region,
        String usageType,
        String operation,
        String resourceId,
        @NotBlank String lineItemType,
        @NotNull BigDecimal unblendedCost,
        BigDecimal netAmortizedCost,
        BigDecimal usageAmount,
        String currencyCode,
        @Pattern(regexp = "cur|cost_explorer") String dataSource
) {
}
