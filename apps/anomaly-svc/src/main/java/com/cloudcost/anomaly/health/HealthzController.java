package com.cloudcost.anomaly.health;

import com.cloudcost.anomaly.config.CostAnomalyProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check for load balancers. Reports the detection defaults in effect but never queries the
 * cost store; the Actuator health endpoint covers the database.
 */
@RestController
public class HealthzController {

    static final String SERVICE_NAME = "anomaly-svc";

    private final CostAnomalyProperties properties;
    private final Clock clock;

    @Autowired
    public HealthzController(CostAnomalyProperties properties) {
        this(properties, Clock.systemUTC());
    }

    HealthzController(CostAnomalyProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", SERVICE_NAME);
        body.put("windowDays", properties.detection().windowDays());
        body.put("sensitivity", properties.detection().sensitivity());
        body.put("checkedAt", Instant.now(clock).toString());
        return body;
    }
}
