package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.Dimension;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class JdbcDailyCostReader implements DailyCostReader {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcDailyCostReader(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<DailyCostRow> readDailyCosts(DailyCostQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("start", Date.valueOf(query.start()))
                .addValue("end", Date.valueOf(query.end()));
        // column names only ever come from the Dimension enum
        String groupColumns = query.groupBy().stream()
                .map(Dimension::column)
                .collect(Collectors.joining(", "));
        StringBuilder sql = new StringBuilder("SELECT ");
        if (!groupColumns.isEmpty()) {
            sql.append(groupColumns).append(", ");
        }
        sql.append("""
                usage_date, SUM(total_net_amortized_cost) AS daily_cost
                FROM daily_cost_summary
                WHERE usage_date >= :start AND usage_date <= :end
                """);
        query.dataSource().ifPresent(source -> {
            sql.append(" AND data_source = :dataSource");
            params.addValue("dataSource", source);
        });
        for (Map.Entry<Dimension, String> filter : query.filters().entrySet()) {
            String param = "filter_" + filter.getKey().column();
            sql.append(" AND ").append(filter.getKey().column()).append(" = :").append(param);
            params.addValue(param, filter.getValue());
        }
        sql.append(" GROUP BY ");
        if (!groupColumns.isEmpty()) {
            sql.append(groupColumns).append(", ");
        }
        sql.append("usage_date");
        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> mapRow(rs, query.groupBy()));
    }

    private DailyCostRow mapRow(ResultSet rs, List<Dimension> groupBy) throws SQLException {
        List<String> values = new ArrayList<>(groupBy.size());
        for (Dimension dimension : groupBy) {
            values.add(rs.getString(dimension.column()));
        }
        return new DailyCostRow(values, rs.getDate("usage_date").toLocalDate(), rs.getDouble("daily_cost"));
    }
}
