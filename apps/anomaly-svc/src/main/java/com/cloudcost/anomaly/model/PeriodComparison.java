package com.cloudcost.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record PeriodComparison(
        LocalDate periodAStart,
        LocalDate periodAEnd,
        LocalDate periodBStart,
        LocalDate periodBEnd,
        Dimension groupBy,
        BigDecimal periodATotal,
        BigDecimal periodBTotal,
        List<Entry> movers,
        List<Entry> newInB,
        List<Entry> disappearedFromA
) {

    public record Entry(
            String groupValue,
            BigDecimal periodACost,
            BigDecimal periodBCost,
            BigDecimal absoluteChange,
            BigDecimal percentageChange
    ) {
    }
}
