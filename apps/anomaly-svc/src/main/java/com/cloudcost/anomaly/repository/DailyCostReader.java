package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.DailyCostRow;
import java.util.List;

/**
 * Read side of the daily aggregate store: one row per distinct (group combination, date) with the
 * summed cost. Rows come back in no particular order.
 */
public interface DailyCostReader {

    List<DailyCostRow> readDailyCosts(DailyCostQuery query);
}
