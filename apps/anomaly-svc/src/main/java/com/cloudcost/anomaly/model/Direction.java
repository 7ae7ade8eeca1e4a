package com.cloudcost.anomaly.model;

public enum Direction {
    SPIKE,
    DROP,
    DRIFT_UP,
    DRIFT_DOWN
}
