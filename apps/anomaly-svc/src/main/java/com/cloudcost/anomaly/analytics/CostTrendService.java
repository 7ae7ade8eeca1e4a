package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.CostTrend;
import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.Granularity;
import com.cloudcost.anomaly.repository.DailyCostQuery;
import com.cloudcost.anomaly.repository.DailyCostReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class CostTrendService {

    private final DailyCostReader dailyCostReader;
    private final Clock clock;

    @Autowired
    public CostTrendService(DailyCostReader dailyCostReader) {
        this(dailyCostReader, Clock.systemUTC());
    }

    CostTrendService(DailyCostReader dailyCostReader, Clock clock) {
        this.dailyCostReader = dailyCostReader;
        this.clock = clock;
    }

    /**
     * Cost time series between two inclusive dates, optionally split by one dimension and
     * narrowed to a single value of it.
     */
    public CostTrend getCostTrend(LocalDate dateStart,
                                  LocalDate dateEnd,
                                  Dimension groupBy,
                                  String filterValue,
                                  Granularity granularity) {
        InvalidDateRangeException.requireOrdered("date_start", dateStart, "date_end", dateEnd);
        boolean hasFilter = filterValue != null && !filterValue.isBlank();
        if (hasFilter && groupBy == null) {
            throw new IllegalArgumentException("filter_value requires group_by to be specified");
        }
        Granularity effective = granularity == null ? Granularity.DAILY : granularity;
        DailyCostQuery query = DailyCostQuery.of(dateStart, dateEnd, groupBy == null ? List.of() : List.of(groupBy), null);
        if (hasFilter) {
            query = query.withFilter(groupBy, filterValue);
        }

        Map<PeriodKey, Double> buckets = new TreeMap<>(Comparator
                .comparing(PeriodKey::periodStart)
                .thenComparing(PeriodKey::groupValue));
        for (DailyCostRow row : dailyCostReader.readDailyCosts(query)) {
            String groupValue = groupBy == null ? "" : row.groupValue();
            buckets.merge(new PeriodKey(effective.periodStart(row.usageDate()), groupValue), row.dailyCost(), Double::sum);
        }

        List<CostTrend.Point> points = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        for (Map.Entry<PeriodKey, Double> entry : buckets.entrySet()) {
            BigDecimal cost = money(entry.getValue());
            points.add(new CostTrend.Point(entry.getKey().periodStart(), groupBy == null ? null : entry.getKey().groupValue(), cost));
            total = total.add(cost);
            min = min == null || cost.compareTo(min) < 0 ? cost : min;
            max = max == null || cost.compareTo(max) > 0 ? cost : max;
        }
        BigDecimal average = points.isEmpty()
                ? money(0d)
                : total.divide(BigDecimal.valueOf(points.size()), 2, RoundingMode.HALF_UP);
        return new CostTrend(dateStart, dateEnd, effective, groupBy, hasFilter ? filterValue : null, points,
                total.setScale(2, RoundingMode.HALF_UP),
                average,
                min == null ? money(0d) : min,
                max == null ? money(0d) : max);
    }

    /**
     * Day-over-day changes for the {@code topN} most expensive groups over the last {@code days} days.
     */
    public List<CostTrend.DailyChange> getDailyChanges(int days, Dimension groupBy, int topN, String dataSource) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        LocalDate today = LocalDate.now(clock);
        List<DailyCostRow> rows = dailyCostReader.readDailyCosts(
                DailyCostQuery.of(today.minusDays(days), today, List.of(groupBy), dataSource));

        Map<String, Double> totals = new HashMap<>();
        rows.forEach(row -> totals.merge(row.groupValue(), row.dailyCost(), Double::sum));
        Set<String> topGroups = totals.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(topN)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());

        Map<String, List<DailyCostRow>> byGroup = rows.stream()
                .filter(row -> topGroups.contains(row.groupValue()))
                .collect(Collectors.groupingBy(DailyCostRow::groupValue));
        List<CostTrend.DailyChange> changes = new ArrayList<>();
        for (Map.Entry<String, List<DailyCostRow>> entry : byGroup.entrySet()) {
            List<DailyCostRow> series = new ArrayList<>(entry.getValue());
            series.sort(Comparator.comparing(DailyCostRow::usageDate));
            Double previous = null;
            for (DailyCostRow row : series) {
                BigDecimal change = previous == null ? null : money(row.dailyCost() - previous);
                BigDecimal pct = previous == null || previous <= 0
                        ? null
                        : money((row.dailyCost() - previous) / previous * 100);
                changes.add(new CostTrend.DailyChange(row.usageDate(), entry.getKey(), money(row.dailyCost()), change, pct));
                previous = row.dailyCost();
            }
        }
        changes.sort(Comparator.comparing(CostTrend.DailyChange::usageDate).thenComparing(CostTrend.DailyChange::groupValue));
        return changes;
    }

    static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private record PeriodKey(LocalDate periodStart, String groupValue) {
    }
}
