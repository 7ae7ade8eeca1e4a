package com.cloudcost.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Line-item level explanation of how one service's cost moved between two periods.
 */
public record CostAttribution(
        String service,
        String accountId,
        LocalDate periodAStart,
        LocalDate periodAEnd,
        LocalDate periodBStart,
        LocalDate periodBEnd,
        BigDecimal periodATotal,
        BigDecimal periodBTotal,
        Breakdown byUsageType,
        Breakdown byResource
) {

    public BigDecimal totalChange() {
        return periodBTotal.subtract(periodATotal);
    }

    /**
     * Keys present in both periods are movers. Keys with no cost in A are new, keys with no cost
     * in B disappeared.
     */
    public record Breakdown(List<PeriodComparison.Entry> movers,
                            List<PeriodComparison.Entry> newInB,
                            List<PeriodComparison.Entry> disappearedFromA) {

        public Breakdown {
            movers = List.copyOf(movers);
            newInB = List.copyOf(newInB);
            disappearedFromA = List.copyOf(disappearedFromA);
        }
    }
}
