package com.cloudcost.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record AnomalyExplanation(
        String service,
        LocalDate anomalyDate,
        String accountId,
        BigDecimal baselineMedian,
        BigDecimal baselineMin,
        BigDecimal baselineMax,
        BigDecimal anomalyCost,
        BigDecimal costVsMedian,
        BigDecimal costMultiple,
        boolean ongoing,
        int daysAfterChecked,
        int elevatedDaysAfter,
        boolean hasBaseline,
        boolean hasLineItems,
        List<UsageTypeChange> topUsageTypeChanges
) {

    public AnomalyExplanation {
        topUsageTypeChanges = topUsageTypeChanges == null ? List.of() : List.copyOf(topUsageTypeChanges);
    }

    /**
     * Usage type cost on the anomalous day against its average daily cost over the baseline.
     * {@code percentageChange} is null when the usage type had no baseline cost.
     */
    public record UsageTypeChange(
            String usageType,
            BigDecimal baselineDailyCost,
            BigDecimal anomalyCost,
            BigDecimal absoluteChange,
            BigDecimal percentageChange
    ) {
    }
}
