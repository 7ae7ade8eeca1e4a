package com.cloudcost.anomaly.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AnomaliesControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void clearStore() {
        jdbcTemplate.update("DELETE FROM cost_line_items");
        jdbcTemplate.update("DELETE FROM daily_cost_summary");
    }

    @Test
    void unknownGroupingIsBadRequest() throws Exception {
        mockMvc.perform(get("/anomalies")
                        .param("groupBy", "service+flavor")
                        .header("X-Request-Trace", "trace-abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_GROUPING"))
                .andExpect(jsonPath("$.traceId").value("trace-abc"));
    }

    @Test
    void emptyStoreYieldsNoAnomalies() throws Exception {
        mockMvc.perform(get("/anomalies")
                        .param("groupBy", "service+region")
                        .param("referenceDate", "2024-06-15")
                        .param("sensitivity", "high"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(jsonPath("$.groupBy").value("service+region"))
                .andExpect(jsonPath("$.sensitivity").value("high"))
                .andExpect(jsonPath("$.windowDays").value(14));
    }

    @Test
    void reversedScanRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/anomalies/scan")
                        .param("start", "2024-06-30")
                        .param("end", "2024-06-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DATE_RANGE"));
    }

    @Test
    void malformedDateIsInvalidArgument() throws Exception {
        mockMvc.perform(get("/anomalies").param("referenceDate", "15/06/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void explainWithoutDataIsNotFound() throws Exception {
        mockMvc.perform(get("/anomalies/explain")
                        .param("service", "AmazonEC2")
                        .param("date", "2024-06-15"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void missingRequiredParameterIsValidationError() throws Exception {
        mockMvc.perform(get("/comparisons").param("periodAStart", "2024-06-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void comparisonOfEmptyPeriodsHasNoMovers() throws Exception {
        mockMvc.perform(get("/comparisons")
                        .param("periodAStart", "2024-05-01")
                        .param("periodAEnd", "2024-05-31")
                        .param("periodBStart", "2024-06-01")
                        .param("periodBEnd", "2024-06-30")
                        .param("groupBy", "account"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupBy").value("account"))
                .andExpect(jsonPath("$.movers").isEmpty());
    }

    @Test
    void attributionWithReversedPeriodIsInvalidDateRange() throws Exception {
        mockMvc.perform(get("/comparisons/attribution")
                        .param("service", "AmazonEC2")
                        .param("periodAStart", "2024-05-31")
                        .param("periodAEnd", "2024-05-01")
                        .param("periodBStart", "2024-06-01")
                        .param("periodBEnd", "2024-06-30"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DATE_RANGE"));
    }

    @Test
    void attributionWithoutLineItemsIsNotFound() throws Exception {
        mockMvc.perform(get("/comparisons/attribution")
                        .param("service", "AmazonEC2")
                        .param("periodAStart", "2024-05-01")
                        .param("periodAEnd", "2024-05-31")
                        .param("periodBStart", "2024-06-01")
                        .param("periodBEnd", "2024-06-30"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void drillDownWithZeroTopNIsInvalidArgument() throws Exception {
        mockMvc.perform(get("/anomalies/drilldown")
                        .param("service", "AmazonEC2")
                        .param("dateStart", "2024-06-01")
                        .param("dateEnd", "2024-06-15")
                        .param("topN", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }
}
