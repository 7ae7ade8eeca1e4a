package com.cloudcost.anomaly.repository;

/**
 * Line-item columns that cost can be broken down by. The enum is the only source of column names
 * that reach breakdown SQL.
 */
public enum LineItemField {
    USAGE_TYPE("usage_type"),
    OPERATION("operation"),
    RESOURCE_ID("resource_id");

    private final String column;

    LineItemField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
