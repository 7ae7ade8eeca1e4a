package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.Dimension;
import java.time.LocalDate;

/**
 * One pre-aggregated summary row as held by {@link InMemoryDailyCostReader}.
 */
public record DailyCostSummary(
        LocalDate usageDate,
        String usageAccountId,
        String productCode,
        String region,
        String dataSource,
        double netAmortizedCost
) {

    public String valueOf(Dimension dimension) {
        return switch (dimension) {
            case SERVICE -> productCode;
            case ACCOUNT -> usageAccountId;
            case REGION -> region;
        };
    }
}
