package com.cloudcost.anomaly.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final CostAnomalyProperties props;

    public StartupDiagnostics(CostAnomalyProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var detection = props.detection();
        log.info("Detection config: windowDays={}, sensitivity='{}' (z>={}), minDailyCost={}, driftThreshold={}%",
                detection.windowDays(), detection.sensitivity(), detection.sensitivityLevel().zScoreThreshold(),
                detection.minDailyCost(), detection.driftThresholdPct());
        log.info("Ingestion config: excludedLineItemTypes={}", props.ingestion().excludedLineItemTypes());
    }
}
