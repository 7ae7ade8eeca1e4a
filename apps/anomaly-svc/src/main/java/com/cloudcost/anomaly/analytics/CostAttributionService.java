package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.CostAttribution;
import com.cloudcost.anomaly.model.PeriodComparison;
import com.cloudcost.anomaly.repository.LineItemBreakdownReader;
import com.cloudcost.anomaly.repository.LineItemCostRow;
import com.cloudcost.anomaly.repository.LineItemField;
import com.cloudcost.anomaly.repository.LineItemQuery;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Explains a cost change of one service between two periods by usage type and by resource.
 */
@Service
public class CostAttributionService {

    private final LineItemBreakdownReader lineItemBreakdownReader;

    public CostAttributionService(LineItemBreakdownReader lineItemBreakdownReader) {
        this.lineItemBreakdownReader = lineItemBreakdownReader;
    }

    public CostAttribution attribute(String service,
                                     LocalDate periodAStart,
                                     LocalDate periodAEnd,
                                     LocalDate periodBStart,
                                     LocalDate periodBEnd,
                                     String accountId,
                                     int topN) {
        InvalidDateRangeException.requireOrdered("period_a_start", periodAStart, "period_a_end", periodAEnd);
        InvalidDateRangeException.requireOrdered("period_b_start", periodBStart, "period_b_end", periodBEnd);
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        LineItemQuery periodA = new LineItemQuery(service, accountId, periodAStart, periodAEnd);
        LineItemQuery periodB = periodA.withDates(periodBStart, periodBEnd);
        if (lineItemBreakdownReader.countLineItems(periodA) == 0 && lineItemBreakdownReader.countLineItems(periodB) == 0) {
            throw new CostDataNotFoundException("No line items found for " + service + " in either period.");
        }

        Map<String, Double> usageTypesA = sums(LineItemField.USAGE_TYPE, periodA);
        Map<String, Double> usageTypesB = sums(LineItemField.USAGE_TYPE, periodB);
        double totalA = usageTypesA.values().stream().mapToDouble(Double::doubleValue).sum();
        double totalB = usageTypesB.values().stream().mapToDouble(Double::doubleValue).sum();

        return new CostAttribution(service, periodA.accountId(),
                periodAStart, periodAEnd, periodBStart, periodBEnd,
                CostTrendService.money(totalA), CostTrendService.money(totalB),
                breakdown(usageTypesA, usageTypesB, topN),
                breakdown(sums(LineItemField.RESOURCE_ID, periodA), sums(LineItemField.RESOURCE_ID, periodB), topN));
    }

    // merged in memory: H2 has no FULL OUTER JOIN
    private Map<String, Double> sums(LineItemField field, LineItemQuery query) {
        Map<String, Double> sums = new HashMap<>();
        for (LineItemCostRow row : lineItemBreakdownReader.sumBy(field, query)) {
            sums.merge(CostDrillDownService.keyOf(row), row.unblendedCost(), Double::sum);
        }
        return sums;
    }

    private static CostAttribution.Breakdown breakdown(Map<String, Double> periodA, Map<String, Double> periodB, int topN) {
        Set<String> keys = new LinkedHashSet<>(periodA.keySet());
        keys.addAll(periodB.keySet());
        List<String> ordered = new ArrayList<>(keys);
        ordered.sort(Comparator.comparingDouble((String key) ->
                Math.abs(periodB.getOrDefault(key, 0d) - periodA.getOrDefault(key, 0d))).reversed());

        List<PeriodComparison.Entry> movers = new ArrayList<>();
        List<PeriodComparison.Entry> newInB = new ArrayList<>();
        List<PeriodComparison.Entry> disappeared = new ArrayList<>();
        for (String key : ordered) {
            double a = periodA.getOrDefault(key, 0d);
            double b = periodB.getOrDefault(key, 0d);
            BigDecimal pct = a == 0d ? null : BigDecimal.valueOf((b - a) / a * 100).setScale(1, RoundingMode.HALF_UP);
            PeriodComparison.Entry entry = new PeriodComparison.Entry(key,
                    CostTrendService.money(a), CostTrendService.money(b), CostTrendService.money(b - a), pct);
            List<PeriodComparison.Entry> target = a == 0d ? newInB : b == 0d ? disappeared : movers;
            if (target.size() < topN) {
                target.add(entry);
            }
        }
        return new CostAttribution.Breakdown(movers, newInB, disappeared);
    }
}
