package com.cloudcost.anomaly.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Cost dimensions a daily series can be grouped by. Each constant owns the summary
 * column it reads, so no caller-supplied text ever reaches a query.
 */
public enum Dimension {
    SERVICE("service", "product_code"),
    ACCOUNT("account", "usage_account_id"),
    REGION("region", "region");

    private final String key;
    private final String column;

    Dimension(String key, String column) {
        this.key = key;
        this.column = column;
    }

    public String key() {
        return key;
    }

    public String column() {
        return column;
    }

    /**
     * Accepts the short key ({@code service}) or the column name ({@code product_code}), case-insensitive.
     */
    public static Dimension fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Dimension dimension : values()) {
                if (dimension.key.equals(normalized) || dimension.column.equals(normalized)) {
                    return dimension;
                }
            }
        }
        throw new InvalidGroupingException("group_by must be one of " + allowedKeys() + ", got '" + name + "'");
    }

    /**
     * Parses a {@code +} separated grouping such as {@code service+account}.
     */
    public static List<Dimension> parseGrouping(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidGroupingException("group_by must name at least one of " + allowedKeys());
        }
        List<Dimension> dimensions = new ArrayList<>();
        for (String part : expression.split("\\+")) {
            Dimension dimension = fromName(part);
            if (dimensions.contains(dimension)) {
                throw new InvalidGroupingException("group_by lists '" + dimension.key + "' more than once");
            }
            dimensions.add(dimension);
        }
        return List.copyOf(dimensions);
    }

    public static String label(List<Dimension> dimensions) {
        return dimensions.stream().map(Dimension::key).collect(Collectors.joining("+"));
    }

    private static String allowedKeys() {
        return Arrays.stream(values()).map(Dimension::key).toList().toString();
    }
}
