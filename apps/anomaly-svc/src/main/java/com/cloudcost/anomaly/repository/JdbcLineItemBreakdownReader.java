package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.config.CostAnomalyProperties;
import java.sql.Timestamp;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcLineItemBreakdownReader implements LineItemBreakdownReader {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final List<String> excludedLineItemTypes;

    public JdbcLineItemBreakdownReader(NamedParameterJdbcTemplate jdbcTemplate, CostAnomalyProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.excludedLineItemTypes = properties.ingestion().excludedLineItemTypes();
    }

    @Override
    public long countLineItems(LineItemQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = where(query, params);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM cost_line_items WHERE " + where, params, Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public List<LineItemCostRow> sumBy(LineItemField field, LineItemQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder where = new StringBuilder(where(query, params));
        if (field == LineItemField.RESOURCE_ID) {
            where.append(" AND resource_id IS NOT NULL AND resource_id <> ''");
        }
        String sql = """
                SELECT %1$s AS item_key,
                       CAST(SUM(unblended_cost) AS DOUBLE PRECISION) AS unblended,
                       CAST(SUM(COALESCE(net_amortized_cost, unblended_cost)) AS DOUBLE PRECISION) AS net_amortized,
                       CAST(SUM(COALESCE(usage_amount, 0)) AS DOUBLE PRECISION) AS usage_amount
                FROM cost_line_items
                WHERE %2$s
                GROUP BY %1$s
                ORDER BY unblended DESC
                """.formatted(field.column(), where);
        return jdbcTemplate.query(sql, params, (rs, rowNum) -> new LineItemCostRow(
                rs.getString("item_key"),
                rs.getDouble("unblended"),
                rs.getDouble("net_amortized"),
                rs.getDouble("usage_amount")));
    }

    // same line item types as the daily summary are left out
    private String where(LineItemQuery query, MapSqlParameterSource params) {
        params.addValue("productCode", query.productCode())
                .addValue("from", Timestamp.valueOf(query.start().atStartOfDay()))
                .addValue("to", Timestamp.valueOf(query.end().plusDays(1).atStartOfDay()))
                .addValue("excluded", excludedLineItemTypes);
        String where = "product_code = :productCode AND usage_start_date >= :from AND usage_start_date < :to"
                + " AND line_item_type NOT IN (:excluded)";
        if (query.accountId() != null) {
            params.addValue("accountId", query.accountId());
            where += " AND usage_account_id = :accountId";
        }
        return where;
    }
}
