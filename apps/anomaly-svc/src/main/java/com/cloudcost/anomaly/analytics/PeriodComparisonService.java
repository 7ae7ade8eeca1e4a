package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.PeriodComparison;
import com.cloudcost.anomaly.repository.DailyCostQuery;
import com.cloudcost.anomaly.repository.DailyCostReader;
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

@Service
public class PeriodComparisonService {

    private final DailyCostReader dailyCostReader;

    public PeriodComparisonService(DailyCostReader dailyCostReader) {
        this.dailyCostReader = dailyCostReader;
    }

    public PeriodComparison compare(LocalDate periodAStart,
                                    LocalDate periodAEnd,
                                    LocalDate periodBStart,
                                    LocalDate periodBEnd,
                                    Dimension groupBy,
                                    int topN) {
        InvalidDateRangeException.requireOrdered("period_a_start", periodAStart, "period_a_end", periodAEnd);
        InvalidDateRangeException.requireOrdered("period_b_start", periodBStart, "period_b_end", periodBEnd);
        if (groupBy == null) {
            throw new IllegalArgumentException("group_by must be provided");
        }
        Map<String, Double> periodA = totalsByGroup(periodAStart, periodAEnd, groupBy);
        Map<String, Double> periodB = totalsByGroup(periodBStart, periodBEnd, groupBy);

        Set<String> groups = new LinkedHashSet<>(periodA.keySet());
        groups.addAll(periodB.keySet());
        List<String> ordered = new ArrayList<>(groups);
        ordered.sort(Comparator.comparingDouble((String group) ->
                Math.abs(periodB.getOrDefault(group, 0d) - periodA.getOrDefault(group, 0d))).reversed());

        List<PeriodComparison.Entry> movers = new ArrayList<>();
        List<PeriodComparison.Entry> newInB = new ArrayList<>();
        List<PeriodComparison.Entry> disappeared = new ArrayList<>();
        double totalA = 0d;
        double totalB = 0d;
        for (String group : ordered) {
            double a = periodA.getOrDefault(group, 0d);
            double b = periodB.getOrDefault(group, 0d);
            totalA += a;
            totalB += b;
            BigDecimal pct = a == 0d ? null : BigDecimal.valueOf((b - a) / a * 100).setScale(1, RoundingMode.HALF_UP);
            PeriodComparison.Entry entry = new PeriodComparison.Entry(group,
                    CostTrendService.money(a), CostTrendService.money(b), CostTrendService.money(b - a), pct);
            if (a == 0d) {
                newInB.add(entry);
            } else if (b == 0d) {
                disappeared.add(entry);
            } else {
                movers.add(entry);
            }
        }
        return new PeriodComparison(periodAStart, periodAEnd, periodBStart, periodBEnd, groupBy,
                CostTrendService.money(totalA), CostTrendService.money(totalB),
                movers.stream().limit(Math.max(0, topN)).toList(),
                List.copyOf(newInB),
                List.copyOf(disappeared));
    }

    private Map<String, Double> totalsByGroup(LocalDate start, LocalDate end, Dimension groupBy) {
        Map<String, Double> totals = new HashMap<>();
        for (DailyCostRow row : dailyCostReader.readDailyCosts(DailyCostQuery.of(start, end, List.of(groupBy), null))) {
            totals.merge(row.groupValue(), row.dailyCost(), Double::sum);
        }
        return totals;
    }
}
