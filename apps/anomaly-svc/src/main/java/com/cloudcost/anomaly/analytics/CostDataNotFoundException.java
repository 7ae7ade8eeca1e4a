package com.cloudcost.anomaly.analytics;

public class CostDataNotFoundException extends RuntimeException {

    public CostDataNotFoundException(String message) {
        super(message);
    }
}
