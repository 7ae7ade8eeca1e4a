package com.cloudcost.anomaly.model;

import java.time.LocalDate;

public record CostObservation(String groupValue, LocalDate usageDate, double dailyCost) {
}
