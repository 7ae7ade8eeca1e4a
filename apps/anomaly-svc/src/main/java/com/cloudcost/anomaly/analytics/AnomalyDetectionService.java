package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.Anomaly;
import com.cloudcost.anomaly.model.CostObservation;
import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.DetectionParameters;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.PointAnomaly;
import com.cloudcost.anomaly.model.TrendAnomaly;
import com.cloudcost.anomaly.repository.DailyCostQuery;
import com.cloudcost.anomaly.repository.DailyCostReader;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Point anomalies from a median/MAD modified z-score, trend anomalies from a Theil-Sen slope over
 * the whole window. Groups without enough usable history are skipped, never reported as errors.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final int MIN_OBSERVATIONS = 3;
    static final int MIN_TREND_OBSERVATIONS = 5;
    static final double FLAT_MAD_EPSILON = 1e-10d;
    /** Stand-in z-score when the baseline has no spread at all. Not a real statistic. */
    static final double SATURATED_Z_SCORE = 10.0d;

    private final DailyCostReader dailyCostReader;
    private final Clock clock;

    @Autowired
    public AnomalyDetectionService(DailyCostReader dailyCostReader) {
        this(dailyCostReader, Clock.systemUTC());
    }

    AnomalyDetectionService(DailyCostReader dailyCostReader, Clock clock) {
        this.dailyCostReader = dailyCostReader;
        this.clock = clock;
    }

    public List<Anomaly> detect(DetectionParameters parameters) {
        LocalDate referenceDate = parameters.referenceDate() != null
                ? parameters.referenceDate()
                : LocalDate.now(clock);
        LocalDate windowStart = referenceDate.minusDays(parameters.windowDays());
        List<DailyCostRow> rows = dailyCostReader.readDailyCosts(
                DailyCostQuery.of(windowStart, referenceDate, parameters.groupBy(), parameters.dataSource()));

        Map<String, List<CostObservation>> series = partition(rows);
        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<CostObservation>> entry : series.entrySet()) {
            evaluateGroup(entry.getKey(), entry.getValue(), parameters, anomalies);
        }
        anomalies.sort(Anomaly.RANKING);
        log.debug("Anomaly detection as of {} by {}: {} groups, {} anomalies",
                referenceDate, Dimension.label(parameters.groupBy()), series.size(), anomalies.size());
        return anomalies;
    }

    private Map<String, List<CostObservation>> partition(List<DailyCostRow> rows) {
        Map<String, List<CostObservation>> series = new LinkedHashMap<>();
        for (DailyCostRow row : rows) {
            CostObservation observation = row.toObservation();
            series.computeIfAbsent(observation.groupValue(), key -> new ArrayList<>()).add(observation);
        }
        series.values().forEach(list -> list.sort(Comparator.comparing(CostObservation::usageDate)));
        return series;
    }

    private void evaluateGroup(String groupValue,
                               List<CostObservation> observations,
                               DetectionParameters parameters,
                               List<Anomaly> anomalies) {
        if (observations.size() < MIN_OBSERVATIONS) {
            log.debug("Skipping {}: only {} observations", groupValue, observations.size());
            return;
        }
        CostObservation current = observations.get(observations.size() - 1);
        double currentCost = current.dailyCost();
        if (currentCost < parameters.minDailyCost()) {
            return;
        }
        double[] baseline = observations.subList(0, observations.size() - 1).stream()
                .mapToDouble(CostObservation::dailyCost)
                .toArray();
        double median = RobustStatistics.median(baseline);
        double mad = RobustStatistics.medianAbsoluteDeviation(baseline, median);

        double zScore;
        if (mad < FLAT_MAD_EPSILON) {
            zScore = Math.abs(currentCost - median) > parameters.minDailyCost()
                    ? Math.copySign(SATURATED_Z_SCORE, currentCost - median)
                    : 0d;
        } else {
            zScore = RobustStatistics.modifiedZScore(currentCost, median, mad);
        }
        if (Math.abs(zScore) >= parameters.sensitivity().zScoreThreshold()) {
            anomalies.add(new PointAnomaly(current.usageDate(), parameters.groupBy(), groupValue,
                    currentCost, median, mad, zScore));
        }

        if (observations.size() >= MIN_TREND_OBSERVATIONS && median > parameters.minDailyCost()) {
            double[] costs = observations.stream().mapToDouble(CostObservation::dailyCost).toArray();
            double slope = RobustStatistics.theilSenSlope(costs);
            double driftFraction = slope * costs.length / median;
            if (Math.abs(driftFraction) >= parameters.driftThreshold()) {
                anomalies.add(new TrendAnomaly(current.usageDate(), parameters.groupBy(), groupValue,
                        currentCost, median, mad, driftFraction));
            }
        }
    }
}
