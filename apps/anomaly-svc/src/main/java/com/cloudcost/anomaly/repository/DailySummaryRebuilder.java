package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.config.CostAnomalyProperties;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Recomputes {@code daily_cost_summary} from {@code cost_line_items}. Non-usage line item types
 * (tax, fees, credits and the like) are left out of the totals.
 */
@Repository
public class DailySummaryRebuilder {

    private static final Logger log = LoggerFactory.getLogger(DailySummaryRebuilder.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final List<String> excludedLineItemTypes;

    public DailySummaryRebuilder(NamedParameterJdbcTemplate jdbcTemplate, CostAnomalyProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.excludedLineItemTypes = properties.ingestion().excludedLineItemTypes();
    }

    @Transactional
    public int rebuild() {
        int removed = jdbcTemplate.update("DELETE FROM daily_cost_summary", new MapSqlParameterSource());
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("excluded", excludedLineItemTypes);
        int inserted = jdbcTemplate.update("""
                INSERT INTO daily_cost_summary (
                    usage_date, usage_account_id, product_code, region, data_source,
                    total_unblended_cost, total_net_amortized_cost, total_usage_amount, line_item_count
                )
                SELECT CAST(usage_start_date AS DATE),
                       usage_account_id,
                       product_code,
                       region,
                       data_source,
                       CAST(SUM(unblended_cost) AS DOUBLE PRECISION),
                       CAST(SUM(COALESCE(net_amortized_cost, unblended_cost)) AS DOUBLE PRECISION),
                       CAST(SUM(COALESCE(usage_amount, 0)) AS DOUBLE PRECISION),
                       COUNT(*)
                FROM cost_line_items
                WHERE line_item_type NOT IN (:excluded)
                GROUP BY CAST(usage_start_date AS DATE), usage_account_id, product_code, region, data_source
                """, params);
        log.info("Daily summary rebuilt: {} rows replaced by {} rows", removed, inserted);
        return inserted;
    }
}
