package com.cloudcost.anomaly.model;

/**
 * Declaration order is the ranking order: critical first.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    public int rank() {
        return ordinal();
    }
}
