package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.analytics.CostTrendService;
import com.cloudcost.anomaly.controller.dto.CostTrendResponseDto;
import com.cloudcost.anomaly.controller.dto.DailyChangesResponseDto;
import com.cloudcost.anomaly.model.CostTrend;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.Granularity;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/trends")
public class TrendsController {

    private final CostTrendService costTrendService;

    public TrendsController(CostTrendService costTrendService) {
        this.costTrendService = costTrendService;
    }

    @GetMapping
    public ResponseEntity<CostTrendResponseDto> getTrend(
            @RequestParam("dateStart") String dateStart,
            @RequestParam("dateEnd") String dateEnd,
            @RequestParam(value = "groupBy", required = false) String groupBy,
            @RequestParam(value = "filterValue", required = false) String filterValue,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        Dimension dimension = groupBy == null || groupBy.isBlank() ? null : Dimension.fromName(groupBy);
        CostTrend trend = costTrendService.getCostTrend(
                RequestParams.requireDate("dateStart", dateStart),
                RequestParams.requireDate("dateEnd", dateEnd),
                dimension,
                filterValue,
                Granularity.fromName(granularity));
        List<CostTrendResponseDto.PointDto> points = trend.points().stream()
                .map(point -> new CostTrendResponseDto.PointDto(point.periodStart(), point.groupValue(), point.cost()))
                .toList();
        return ResponseEntity.ok(new CostTrendResponseDto(
                trend.dateStart(),
                trend.dateEnd(),
                trend.granularity().name().toLowerCase(Locale.ROOT),
                trend.groupBy() == null ? null : trend.groupBy().key(),
                trend.filterValue(),
                new CostTrendResponseDto.SummaryDto(trend.total(), trend.average(), trend.minCost(), trend.maxCost(), points.size()),
                points,
                RequestParams.traceId()
        ));
    }

    @GetMapping("/daily-changes")
    public ResponseEntity<DailyChangesResponseDto> getDailyChanges(
            @RequestParam(value = "days", required = false, defaultValue = "14") Integer days,
            @RequestParam(value = "groupBy", required = false, defaultValue = "service") String groupBy,
            @RequestParam(value = "topN", required = false, defaultValue = "10") Integer topN,
            @RequestParam(value = "dataSource", required = false) String dataSource
    ) {
        Dimension dimension = Dimension.fromName(groupBy);
        List<DailyChangesResponseDto.ChangeDto> changes = costTrendService.getDailyChanges(days, dimension, topN, dataSource).stream()
                .map(change -> new DailyChangesResponseDto.ChangeDto(
                        change.usageDate(), change.groupValue(), change.totalCost(), change.costChange(), change.pctChange()))
                .toList();
        return ResponseEntity.ok(new DailyChangesResponseDto(days, dimension.key(), changes, RequestParams.traceId()));
    }
}
