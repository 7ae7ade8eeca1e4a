package com.cloudcost.anomaly.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cloudcost.anomaly.config.CostAnomalyProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class HealthzControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void healthzReturnsUpWithDetectionDefaults() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("anomaly-svc"))
                .andExpect(jsonPath("$.windowDays").value(14))
                .andExpect(jsonPath("$.sensitivity").value("medium"))
                .andExpect(jsonPath("$.checkedAt").exists())
                .andExpect(header().exists("X-Request-Trace"));
    }

    @Test
    void checkedAtComesFromClock() {
        CostAnomalyProperties properties = new CostAnomalyProperties(
                new CostAnomalyProperties.Detection(30, "high", null, null), null);
        HealthzController controller = new HealthzController(properties,
                Clock.fixed(Instant.parse("2024-06-15T08:00:00Z"), ZoneOffset.UTC));

        Map<String, Object> body = controller.healthz();

        assertThat(body).containsEntry("checkedAt", "2024-06-15T08:00:00Z")
                .containsEntry("windowDays", 30)
                .containsEntry("sensitivity", "high");
    }
}
