package com.cloudcost.anomaly.model;

import java.util.Locale;

public enum Sensitivity {
    LOW(3.0d),
    MEDIUM(2.5d),
    HIGH(2.0d);

    private final double zScoreThreshold;

    Sensitivity(double zScoreThreshold) {
        this.zScoreThreshold = zScoreThreshold;
    }

    public double zScoreThreshold() {
        return zScoreThreshold;
    }

    /**
     * Unrecognised names resolve to {@link #MEDIUM}.
     */
    public static Sensitivity fromName(String name) {
        if (name == null) {
            return MEDIUM;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return MEDIUM;
        }
    }
}
