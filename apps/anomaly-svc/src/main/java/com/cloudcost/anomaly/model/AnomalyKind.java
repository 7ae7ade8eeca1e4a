package com.cloudcost.anomaly.model;

public enum AnomalyKind {
    POINT,
    TREND
}
