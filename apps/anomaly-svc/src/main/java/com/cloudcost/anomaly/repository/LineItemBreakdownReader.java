package com.cloudcost.anomaly.repository;

import java.util.List;

public interface LineItemBreakdownReader {

    long countLineItems(LineItemQuery query);

    /**
     * Costs grouped by {@code field}, most expensive (unblended) first. Resource breakdowns skip
     * line items without a resource id.
     */
    List<LineItemCostRow> sumBy(LineItemField field, LineItemQuery query);
}
