package com.cloudcost.anomaly.repository;

/**
 * Summed line-item cost for one value of a {@link LineItemField}. {@code key} is null when the
 * line items carry no value for the field.
 */
public record LineItemCostRow(String key, double unblendedCost, double netAmortizedCost, double usageAmount) {
}
