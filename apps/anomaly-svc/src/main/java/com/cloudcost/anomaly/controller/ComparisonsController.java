package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.analytics.CostAttributionService;
import com.cloudcost.anomaly.analytics.PeriodComparisonService;
import com.cloudcost.anomaly.controller.dto.CostAttributionResponseDto;
import com.cloudcost.anomaly.controller.dto.PeriodComparisonResponseDto;
import com.cloudcost.anomaly.model.CostAttribution;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.PeriodComparison;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/comparisons")
public class ComparisonsController {

    private final PeriodComparisonService periodComparisonService;
    private final CostAttributionService costAttributionService;

    public ComparisonsController(PeriodComparisonService periodComparisonService,
                                 CostAttributionService costAttributionService) {
        this.periodComparisonService = periodComparisonService;
        this.costAttributionService = costAttributionService;
    }

    @GetMapping
    public ResponseEntity<PeriodComparisonResponseDto> compare(
            @RequestParam("periodAStart") String periodAStart,
            @RequestParam("periodAEnd") String periodAEnd,
            @RequestParam("periodBStart") String periodBStart,
            @RequestParam("periodBEnd") String periodBEnd,
            @RequestParam(value = "groupBy", required = false, defaultValue = "service") String groupBy,
            @RequestParam(value = "topN", required = false, defaultValue = "10") Integer topN
    ) {
        PeriodComparison comparison = periodComparisonService.compare(
                RequestParams.requireDate("periodAStart", periodAStart),
                RequestParams.requireDate("periodAEnd", periodAEnd),
                RequestParams.requireDate("periodBStart", periodBStart),
                RequestParams.requireDate("periodBEnd", periodBEnd),
                Dimension.fromName(groupBy),
                topN);
        return ResponseEntity.ok(new PeriodComparisonResponseDto(
                new PeriodComparisonResponseDto.PeriodDto(comparison.periodAStart(), comparison.periodAEnd(), comparison.periodATotal()),
                new PeriodComparisonResponseDto.PeriodDto(comparison.periodBStart(), comparison.periodBEnd(), comparison.periodBTotal()),
                comparison.groupBy().key(),
                comparison.periodBTotal().subtract(comparison.periodATotal()),
                map(comparison.movers()),
                map(comparison.newInB()),
                map(comparison.disappearedFromA()),
                RequestParams.traceId()
        ));
    }

    @GetMapping("/attribution")
    public ResponseEntity<CostAttributionResponseDto> attribute(
            @RequestParam("service") String service,
            @RequestParam("periodAStart") String periodAStart,
            @RequestParam("periodAEnd") String periodAEnd,
            @RequestParam("periodBStart") String periodBStart,
            @RequestParam("periodBEnd") String periodBEnd,
            @RequestParam(value = "accountId", required = false) String accountId,
            @RequestParam(value = "topN", required = false, defaultValue = "10") Integer topN
    ) {
        CostAttribution attribution = costAttributionService.attribute(service,
                RequestParams.requireDate("periodAStart", periodAStart),
                RequestParams.requireDate("periodAEnd", periodAEnd),
                RequestParams.requireDate("periodBStart", periodBStart),
                RequestParams.requireDate("periodBEnd", periodBEnd),
                accountId,
                topN);
        return ResponseEntity.ok(new CostAttributionResponseDto(
                attribution.service(),
                attribution.accountId(),
                new PeriodComparisonResponseDto.PeriodDto(attribution.periodAStart(), attribution.periodAEnd(), attribution.periodATotal()),
                new PeriodComparisonResponseDto.PeriodDto(attribution.periodBStart(), attribution.periodBEnd(), attribution.periodBTotal()),
                attribution.totalChange(),
                map(attribution.byUsageType()),
                map(attribution.byResource()),
                RequestParams.traceId()
        ));
    }

    private CostAttributionResponseDto.BreakdownDto map(CostAttribution.Breakdown breakdown) {
        return new CostAttributionResponseDto.BreakdownDto(
                map(breakdown.movers()),
                map(breakdown.newInB()),
                map(breakdown.disappearedFromA()));
    }

    private List<PeriodComparisonResponseDto.EntryDto> map(List<PeriodComparison.Entry> entries) {
        return entries.stream()
                .map(entry -> new PeriodComparisonResponseDto.EntryDto(
                        entry.groupValue(),
                        entry.periodACost(),
                        entry.periodBCost(),
                        entry.absoluteChange(),
                        entry.percentageChange()))
                .toList();
    }
}
