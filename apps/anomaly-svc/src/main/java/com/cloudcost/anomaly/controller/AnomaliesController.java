package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.analytics.AnomalyDetectionService;
import com.cloudcost.anomaly.analytics.AnomalyExplanationService;
import com.cloudcost.anomaly.analytics.AnomalyScanService;
import com.cloudcost.anomaly.analytics.CostDrillDownService;
import com.cloudcost.anomaly.config.CostAnomalyProperties;
import com.cloudcost.anomaly.controller.dto.AnomaliesListResponseDto;
import com.cloudcost.anomaly.controller.dto.AnomalyExplanationResponseDto;
import com.cloudcost.anomaly.controller.dto.AnomalyResponseDto;
import com.cloudcost.anomaly.controller.dto.CostDrillDownResponseDto;
import com.cloudcost.anomaly.controller.dto.ScanResponseDto;
import com.cloudcost.anomaly.model.Anomaly;
import com.cloudcost.anomaly.model.AnomalyExplanation;
import com.cloudcost.anomaly.model.CostDrillDown;
import com.cloudcost.anomaly.model.DetectionParameters;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.ScanResult;
import com.cloudcost.anomaly.model.Sensitivity;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomaliesController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final AnomalyScanService anomalyScanService;
    private final AnomalyExplanationService anomalyExplanationService;
    private final CostDrillDownService costDrillDownService;
    private final CostAnomalyProperties properties;

    public AnomaliesController(
            AnomalyDetectionService anomalyDetectionService,
            AnomalyScanService anomalyScanService,
            AnomalyExplanationService anomalyExplanationService,
            CostDrillDownService costDrillDownService,
            CostAnomalyProperties properties
    ) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.anomalyScanService = anomalyScanService;
        this.anomalyExplanationService = anomalyExplanationService;
        this.costDrillDownService = costDrillDownService;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<AnomaliesListResponseDto> detect(
            @RequestParam(value = "days", required = false) Integer days,
            @RequestParam(value = "groupBy", required = false, defaultValue = "service") String groupBy,
            @RequestParam(value = "sensitivity", required = false) String sensitivity,
            @RequestParam(value = "minDailyCost", required = false) Double minDailyCost,
            @RequestParam(value = "driftThreshold", required = false) Double driftThresholdPct,
            @RequestParam(value = "dataSource", required = false) String dataSource,
            @RequestParam(value = "referenceDate", required = false) String referenceDate
    ) {
        DetectionParameters parameters = parameters(days, groupBy, sensitivity, minDailyCost, driftThresholdPct, dataSource)
                .referenceDate(RequestParams.optionalDate("referenceDate", referenceDate))
                .build();
        List<Anomaly> anomalies = anomalyDetectionService.detect(parameters);
        return ResponseEntity.ok(new AnomaliesListResponseDto(
                parameters.referenceDate(),
                parameters.windowDays(),
                Dimension.label(parameters.groupBy()),
                parameters.sensitivity().name().toLowerCase(Locale.ROOT),
                anomalies.size(),
                anomalies.stream().map(AnomaliesController::map).toList(),
                RequestParams.traceId()
        ));
    }

    @GetMapping("/scan")
    public ResponseEntity<ScanResponseDto> scan(
            @RequestParam(value = "start", required = false) String start,
            @RequestParam(value = "end", required = false) String end,
            @RequestParam(value = "days", required = false) Integer days,
            @RequestParam(value = "groupBy", required = false, defaultValue = "service") String groupBy,
            @RequestParam(value = "sensitivity", required = false) String sensitivity,
            @RequestParam(value = "minDailyCost", required = false) Double minDailyCost,
            @RequestParam(value = "driftThreshold", required = false) Double driftThresholdPct,
            @RequestParam(value = "dataSource", required = false) String dataSource
    ) {
        LocalDate scanStart = RequestParams.requireDate("start", start);
        LocalDate scanEnd = RequestParams.requireDate("end", end);
        DetectionParameters parameters = parameters(days, groupBy, sensitivity, minDailyCost, driftThresholdPct, dataSource).build();
        ScanResult result = anomalyScanService.scan(scanStart, scanEnd, parameters);
        return ResponseEntity.ok(new ScanResponseDto(
                result.scanStart(),
                result.scanEnd(),
                result.daysScanned(),
                Dimension.label(parameters.groupBy()),
                result.anomalies().size(),
                result.anomalies().stream().map(AnomaliesController::map).toList(),
                RequestParams.traceId()
        ));
    }

    @GetMapping("/explain")
    public ResponseEntity<AnomalyExplanationResponseDto> explain(
            @RequestParam("service") String service,
            @RequestParam("date") String date,
            @RequestParam(value = "accountId", required = false) String accountId,
            @RequestParam(value = "baselineDays", required = false, defaultValue = "14") Integer baselineDays
    ) {
        AnomalyExplanation explanation = anomalyExplanationService.explain(
                service, RequestParams.requireDate("date", date), accountId, baselineDays);
        return ResponseEntity.ok(new AnomalyExplanationResponseDto(
                explanation.service(),
                explanation.anomalyDate(),
                explanation.accountId(),
                new AnomalyExplanationResponseDto.BaselineDto(
                        explanation.baselineMedian(),
                        explanation.baselineMin(),
                        explanation.baselineMax(),
                        explanation.hasBaseline()),
                explanation.anomalyCost(),
                explanation.costVsMedian(),
                explanation.costMultiple(),
                new AnomalyExplanationResponseDto.OngoingDto(
                        explanation.ongoing(),
                        explanation.daysAfterChecked(),
                        explanation.elevatedDaysAfter()),
                explanation.hasLineItems(),
                explanation.topUsageTypeChanges().stream()
                        .map(change -> new AnomalyExplanationResponseDto.UsageTypeChangeDto(
                                change.usageType(),
                                change.baselineDailyCost(),
                                change.anomalyCost(),
                                change.absoluteChange(),
                                change.percentageChange()))
                        .toList(),
                RequestParams.traceId()
        ));
    }

    @GetMapping("/drilldown")
    public ResponseEntity<CostDrillDownResponseDto> drillDown(
            @RequestParam("service") String service,
            @RequestParam("dateStart") String dateStart,
            @RequestParam("dateEnd") String dateEnd,
            @RequestParam(value = "accountId", required = false) String accountId,
            @RequestParam(value = "topN", required = false, defaultValue = "10") Integer topN
    ) {
        CostDrillDown drillDown = costDrillDownService.drillDown(service,
                RequestParams.requireDate("dateStart", dateStart),
                RequestParams.requireDate("dateEnd", dateEnd),
                accountId,
                topN);
        return ResponseEntity.ok(new CostDrillDownResponseDto(
                drillDown.service(),
                drillDown.dateStart(),
                drillDown.dateEnd(),
                drillDown.accountId(),
                drillDown.totalCost(),
                drillDown.lineItemCount(),
                shares(drillDown.byUsageType()),
                shares(drillDown.byOperation()),
                shares(drillDown.topResources()),
                RequestParams.traceId()
        ));
    }

    private static List<CostDrillDownResponseDto.ShareDto> shares(List<CostDrillDown.Share> shares) {
        return shares.stream()
                .map(share -> new CostDrillDownResponseDto.ShareDto(
                        share.key(), share.cost(), share.percentageOfTotal(), share.usageAmount()))
                .toList();
    }

    private DetectionParameters.Builder parameters(Integer days,
                                                   String groupBy,
                                                   String sensitivity,
                                                   Double minDailyCost,
                                                   Double driftThresholdPct,
                                                   String dataSource) {
        CostAnomalyProperties.Detection defaults = properties.detection();
        // grouping is parsed first so a bad dimension fails before any other work
        List<Dimension> dimensions = Dimension.parseGrouping(groupBy);
        return DetectionParameters.builder()
                .groupBy(dimensions)
                .windowDays(days != null ? days : defaults.windowDays())
                .sensitivity(sensitivity != null ? Sensitivity.fromName(sensitivity) : defaults.sensitivityLevel())
                .minDailyCost(minDailyCost != null ? minDailyCost : defaults.minDailyCost())
                .driftThreshold(driftThresholdPct != null ? driftThresholdPct / 100.0d : defaults.driftThresholdFraction())
                .dataSource(dataSource);
    }

    private static AnomalyResponseDto map(Anomaly anomaly) {
        return new AnomalyResponseDto(
                anomaly.usageDate(),
                anomaly.groupByLabel(),
                anomaly.groupValue(),
                RequestParams.money(anomaly.currentCost()),
                RequestParams.money(anomaly.medianCost()),
                RequestParams.money(anomaly.mad()),
                Math.round(anomaly.zScore() * 100d) / 100d,
                anomaly.severity().name().toLowerCase(Locale.ROOT),
                anomaly.direction().name().toLowerCase(Locale.ROOT),
                anomaly.kind().name().toLowerCase(Locale.ROOT)
        );
    }
}
