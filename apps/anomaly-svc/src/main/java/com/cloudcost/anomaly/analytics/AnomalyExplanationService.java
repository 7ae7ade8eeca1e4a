package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.AnomalyExplanation;
import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.repository.DailyCostQuery;
import com.cloudcost.anomaly.repository.DailyCostReader;
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
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

/**
 * Puts one service's anomalous day in context: how it compares with the preceding baseline, whether
 * cost stayed elevated in the week after, and which usage types moved the most.
 */
@Service
public class AnomalyExplanationService {

    static final int DAYS_AFTER = 7;
    static final double ELEVATED_MULTIPLIER = 1.5d;
    static final int TOP_USAGE_TYPE_CHANGES = 10;

    private final DailyCostReader dailyCostReader;
    private final LineItemBreakdownReader lineItemBreakdownReader;

    public AnomalyExplanationService(DailyCostReader dailyCostReader, LineItemBreakdownReader lineItemBreakdownReader) {
        this.dailyCostReader = dailyCostReader;
        this.lineItemBreakdownReader = lineItemBreakdownReader;
    }

    public AnomalyExplanation explain(String service, LocalDate anomalyDate, String accountId, int baselineDays) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must be provided");
        }
        if (baselineDays < 1) {
            throw new IllegalArgumentException("baselineDays must be >= 1");
        }
        LocalDate baselineStart = anomalyDate.minusDays(baselineDays);
        LocalDate baselineEnd = anomalyDate.minusDays(1);
        DailyCostQuery query = DailyCostQuery.of(baselineStart, anomalyDate.plusDays(DAYS_AFTER), List.of(), null)
                .withFilter(Dimension.SERVICE, service)
                .withFilter(Dimension.ACCOUNT, accountId);
        NavigableMap<LocalDate, Double> byDate = new TreeMap<>();
        for (DailyCostRow row : dailyCostReader.readDailyCosts(query)) {
            byDate.merge(row.usageDate(), row.dailyCost(), Double::sum);
        }

        List<Double> baseline = new ArrayList<>(byDate.subMap(baselineStart, true, baselineEnd, true).values());
        Double anomalyCost = byDate.get(anomalyDate);
        if (anomalyCost == null && baseline.isEmpty()) {
            throw new CostDataNotFoundException("No data found for " + service + " on " + anomalyDate
                    + " or in the baseline period (" + baselineStart + " to " + baselineEnd + ").");
        }
        if (anomalyCost == null) {
            throw new CostDataNotFoundException("No data found for " + service + " on " + anomalyDate + ".");
        }
        int baselineDaysWithData = baseline.size();
        boolean hasBaseline = baselineDaysWithData > 0;
        if (!hasBaseline) {
            baseline.add(anomalyCost);
        }
        double[] values = baseline.stream().mapToDouble(Double::doubleValue).toArray();
        BigDecimal median = CostTrendService.money(RobustStatistics.median(values));
        BigDecimal min = CostTrendService.money(baseline.stream().mapToDouble(Double::doubleValue).min().orElse(0d));
        BigDecimal max = CostTrendService.money(baseline.stream().mapToDouble(Double::doubleValue).max().orElse(0d));
        BigDecimal cost = CostTrendService.money(anomalyCost);
        BigDecimal multiple = median.signum() == 0
                ? BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP)
                : cost.divide(median, 1, RoundingMode.HALF_UP);

        double elevatedThreshold = median.doubleValue() * ELEVATED_MULTIPLIER;
        Map<LocalDate, Double> after = byDate.subMap(anomalyDate.plusDays(1), true, anomalyDate.plusDays(DAYS_AFTER), true);
        int elevatedDays = (int) after.values().stream().filter(value -> value > elevatedThreshold).count();

        LineItemQuery anomalyDay = new LineItemQuery(service, accountId, anomalyDate, anomalyDate);
        boolean hasLineItems = lineItemBreakdownReader.countLineItems(anomalyDay) > 0;
        List<AnomalyExplanation.UsageTypeChange> changes = hasLineItems
                ? usageTypeChanges(anomalyDay, baselineStart, baselineEnd, baselineDaysWithData)
                : List.of();

        return new AnomalyExplanation(service, anomalyDate, accountId, median, min, max, cost,
                cost.subtract(median), multiple, elevatedDays > 0, after.size(), elevatedDays, hasBaseline,
                hasLineItems, changes);
    }

    private List<AnomalyExplanation.UsageTypeChange> usageTypeChanges(LineItemQuery anomalyDay,
                                                                      LocalDate baselineStart,
                                                                      LocalDate baselineEnd,
                                                                      int baselineDaysWithData) {
        int divisor = Math.max(baselineDaysWithData, 1);
        Map<String, Double> baselineAverage = new HashMap<>();
        for (LineItemCostRow row : lineItemBreakdownReader.sumBy(LineItemField.USAGE_TYPE,
                anomalyDay.withDates(baselineStart, baselineEnd))) {
            baselineAverage.merge(CostDrillDownService.keyOf(row), row.netAmortizedCost() / divisor, Double::sum);
        }
        Map<String, Double> onAnomalyDay = new HashMap<>();
        for (LineItemCostRow row : lineItemBreakdownReader.sumBy(LineItemField.USAGE_TYPE, anomalyDay)) {
            onAnomalyDay.merge(CostDrillDownService.keyOf(row), row.netAmortizedCost(), Double::sum);
        }

        Set<String> usageTypes = new LinkedHashSet<>(onAnomalyDay.keySet());
        usageTypes.addAll(baselineAverage.keySet());
        return usageTypes.stream()
                .map(usageType -> {
                    double base = baselineAverage.getOrDefault(usageType, 0d);
                    double anomaly = onAnomalyDay.getOrDefault(usageType, 0d);
                    BigDecimal pct = base == 0d
                            ? null
                            : BigDecimal.valueOf((anomaly - base) / base * 100).setScale(1, RoundingMode.HALF_UP);
                    return new AnomalyExplanation.UsageTypeChange(usageType, CostTrendService.money(base),
                            CostTrendService.money(anomaly), CostTrendService.money(anomaly - base), pct);
                })
                .sorted(Comparator.comparing((AnomalyExplanation.UsageTypeChange change) ->
                        change.absoluteChange().abs()).reversed())
                .limit(TOP_USAGE_TYPE_CHANGES)
                .toList();
    }
}
