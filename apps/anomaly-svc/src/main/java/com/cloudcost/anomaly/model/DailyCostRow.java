package com.cloudcost.anomaly.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One aggregate row: the values of the requested grouping columns (in grouping order),
 * the usage date and the summed cost for that combination and date.
 */
public record DailyCostRow(List<String> dimensionValues, LocalDate usageDate, double dailyCost) {

    public static final String GROUP_SEPARATOR = " / ";
    public static final String UNKNOWN = "unknown";

    public DailyCostRow {
        // values may contain nulls for missing dimensions, so List.copyOf is not an option
        dimensionValues = Collections.unmodifiableList(new ArrayList<>(dimensionValues));
    }

    public String groupValue() {
        return dimensionValues.stream()
                .map(value -> value == null || value.isBlank() ? UNKNOWN : value)
                .collect(Collectors.joining(GROUP_SEPARATOR));
    }

    public CostObservation toObservation() {
        return new CostObservation(groupValue(), usageDate, dailyCost);
    }
}
