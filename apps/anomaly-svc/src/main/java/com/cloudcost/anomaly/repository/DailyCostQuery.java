package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.Dimension;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read request against the daily aggregate store. Both dates are inclusive. An empty
 * {@code groupBy} asks for one total per day.
 */
public record DailyCostQuery(
        LocalDate start,
        LocalDate end,
        List<Dimension> groupBy,
        Optional<String> dataSource,
        Map<Dimension, String> filters
) {

    public DailyCostQuery {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must be provided");
        }
        groupBy = List.copyOf(groupBy);
        dataSource = dataSource == null ? Optional.empty() : dataSource.filter(value -> !value.isBlank());
        filters = filters == null || filters.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(filters));
    }

    public static DailyCostQuery of(LocalDate start, LocalDate end, List<Dimension> groupBy, String dataSource) {
        return new DailyCostQuery(start, end, groupBy, Optional.ofNullable(dataSource), Map.of());
    }

    public DailyCostQuery withFilter(Dimension dimension, String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        Map<Dimension, String> merged = new EnumMap<>(Dimension.class);
        merged.putAll(filters);
        merged.put(dimension, value);
        return new DailyCostQuery(start, end, groupBy, dataSource, merged);
    }
}
