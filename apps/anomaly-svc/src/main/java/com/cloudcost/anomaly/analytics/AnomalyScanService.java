package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.Anomaly;
import com.cloudcost.anomaly.model.DetectionParameters;
import com.cloudcost.anomaly.model.ScanResult;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the detector once per day over a historical range and merges consecutive re-detections of
 * the same (group, kind) into a single event.
 */
@Service
public class AnomalyScanService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScanService.class);

    private final AnomalyDetectionService anomalyDetectionService;

    public AnomalyScanService(AnomalyDetectionService anomalyDetectionService) {
        this.anomalyDetectionService = anomalyDetectionService;
    }

    public ScanResult scan(LocalDate scanStart, LocalDate scanEnd, DetectionParameters parameters) {
        if (scanStart == null || scanEnd == null) {
            throw new IllegalArgumentException("scanStart and scanEnd must be provided");
        }
        InvalidDateRangeException.requireOrdered("scan_start", scanStart, "scan_end", scanEnd);

        StreakTable streaks = new StreakTable();
        int daysScanned = 0;
        for (LocalDate day = scanStart; !day.isAfter(scanEnd); day = day.plusDays(1)) {
            daysScanned++;
            List<Anomaly> detections = anomalyDetectionService.detect(parameters.withReferenceDate(day));
            streaks.advance(day, detections);
        }
        List<Anomaly> anomalies = streaks.flush();
        anomalies.sort(Anomaly.RANKING);
        log.info("Anomaly scan {}..{}: {} days scanned, {} events", scanStart, scanEnd, daysScanned, anomalies.size());
        return new ScanResult(scanStart, scanEnd, daysScanned, anomalies);
    }
}
