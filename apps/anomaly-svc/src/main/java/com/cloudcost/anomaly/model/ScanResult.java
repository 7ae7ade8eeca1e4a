package com.cloudcost.anomaly.model;

import java.time.LocalDate;
import java.util.List;

public record ScanResult(LocalDate scanStart, LocalDate scanEnd, int daysScanned, List<Anomaly> anomalies) {

    public ScanResult {
        anomalies = List.copyOf(anomalies);
    }
}
