package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.CostDrillDown;
import com.cloudcost.anomaly.repository.LineItemBreakdownReader;
import com.cloudcost.anomaly.repository.LineItemCostRow;
import com.cloudcost.anomaly.repository.LineItemField;
import com.cloudcost.anomaly.repository.LineItemQuery;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Breaks one service's line items down by usage type, operation and resource.
 */
@Service
public class CostDrillDownService {

    private static final Logger log = LoggerFactory.getLogger(CostDrillDownService.class);
    static final String UNKNOWN = "unknown";

    private final LineItemBreakdownReader lineItemBreakdownReader;

    public CostDrillDownService(LineItemBreakdownReader lineItemBreakdownReader) {
        this.lineItemBreakdownReader = lineItemBreakdownReader;
    }

    public CostDrillDown drillDown(String service, LocalDate dateStart, LocalDate dateEnd, String accountId, int topN) {
        InvalidDateRangeException.requireOrdered("date_start", dateStart, "date_end", dateEnd);
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        LineItemQuery query = new LineItemQuery(service, accountId, dateStart, dateEnd);
        long lineItems = lineItemBreakdownReader.countLineItems(query);
        if (lineItems == 0) {
            throw new CostDataNotFoundException("No line items found for " + service
                    + " between " + dateStart + " and " + dateEnd
                    + (query.accountId() == null ? "" : " in account " + query.accountId()) + ".");
        }

        List<LineItemCostRow> usageTypes = lineItemBreakdownReader.sumBy(LineItemField.USAGE_TYPE, query);
        double total = usageTypes.stream().mapToDouble(LineItemCostRow::unblendedCost).sum();
        log.debug("Drill-down service={} range={}..{} lineItems={} total={}", service, dateStart, dateEnd, lineItems, total);
        return new CostDrillDown(service, dateStart, dateEnd, query.accountId(),
                CostTrendService.money(total),
                lineItems,
                shares(usageTypes, total, topN),
                shares(lineItemBreakdownReader.sumBy(LineItemField.OPERATION, query), total, topN),
                shares(lineItemBreakdownReader.sumBy(LineItemField.RESOURCE_ID, query), total, topN));
    }

    private static List<CostDrillDown.Share> shares(List<LineItemCostRow> rows, double total, int topN) {
        return rows.stream()
                .limit(topN)
                .map(row -> new CostDrillDown.Share(
                        keyOf(row),
                        CostTrendService.money(row.unblendedCost()),
                        total == 0d
                                ? BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP)
                                : BigDecimal.valueOf(row.unblendedCost() / total * 100).setScale(1, RoundingMode.HALF_UP),
                        BigDecimal.valueOf(row.usageAmount()).setScale(4, RoundingMode.HALF_UP)))
                .toList();
    }

    static String keyOf(LineItemCostRow row) {
        return row.key() == null || row.key().isBlank() ? UNKNOWN : row.key();
    }
}
