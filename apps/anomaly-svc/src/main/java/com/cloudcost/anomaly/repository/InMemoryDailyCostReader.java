package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.Dimension;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryDailyCostReader implements DailyCostReader {

    private final List<DailyCostSummary> storage = new CopyOnWriteArrayList<>();

    public void save(DailyCostSummary summary) {
        storage.add(summary);
    }

    public void saveAll(Collection<DailyCostSummary> summaries) {
        storage.addAll(summaries);
    }

    public void clear() {
        storage.clear();
    }

    @Override
    public List<DailyCostRow> readDailyCosts(DailyCostQuery query) {
        Map<GroupDay, Double> totals = new LinkedHashMap<>();
        for (DailyCostSummary summary : storage) {
            if (summary.usageDate().isBefore(query.start()) || summary.usageDate().isAfter(query.end())) {
                continue;
            }
            if (query.dataSource().isPresent() && !query.dataSource().get().equals(summary.dataSource())) {
                continue;
            }
            if (!matchesFilters(summary, query.filters())) {
                continue;
            }
            List<String> values = new ArrayList<>(query.groupBy().size());
            for (Dimension dimension : query.groupBy()) {
                values.add(summary.valueOf(dimension));
            }
            totals.merge(new GroupDay(values, summary.usageDate()), summary.netAmortizedCost(), Double::sum);
        }
        return totals.entrySet().stream()
                .map(entry -> new DailyCostRow(entry.getKey().values(), entry.getKey().usageDate(), entry.getValue()))
                .toList();
    }

    private boolean matchesFilters(DailyCostSummary summary, Map<Dimension, String> filters) {
        return filters.entrySet().stream()
                .allMatch(filter -> Objects.equals(filter.getValue(), summary.valueOf(filter.getKey())));
    }

    private record GroupDay(List<String> values, LocalDate usageDate) {
    }
}
