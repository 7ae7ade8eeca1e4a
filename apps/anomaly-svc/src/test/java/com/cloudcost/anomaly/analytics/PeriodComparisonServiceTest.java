package com.cloudcost.anomaly.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.PeriodComparison;
import com.cloudcost.anomaly.repository.DailyCostSummary;
import com.cloudcost.anomaly.repository.InMemoryDailyCostReader;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PeriodComparisonServiceTest {

    private static final LocalDate A_START = LocalDate.of(2024, 6, 1);
    private static final LocalDate A_END = LocalDate.of(2024, 6, 7);
    private static final LocalDate B_START = LocalDate.of(2024, 6, 8);
    private static final LocalDate B_END = LocalDate.of(2024, 6, 14);

    private final InMemoryDailyCostReader reader = new InMemoryDailyCostReader();
    private final PeriodComparisonService service = new PeriodComparisonService(reader);

    @BeforeEach
    void setUp() {
        LocalDate a = LocalDate.of(2024, 6, 3);
        LocalDate b = LocalDate.of(2024, 6, 10);
        save(a, "AmazonEC2", 100);
        save(a, "AmazonS3", 50);
        save(a, "AWSLambda", 20);
        save(a, "AmazonCloudFront", 30);
        save(b, "AmazonEC2", 150);
        save(b, "AmazonS3", 45);
        save(b, "AmazonRDS", 80);
        save(b, "AmazonCloudFront", 30);
    }

    @Test
    void splitsMoversNewcomersAndDisappeared() {
        PeriodComparison comparison = service.compare(A_START, A_END, B_START, B_END, Dimension.SERVICE, 2);

        assertThat(comparison.periodATotal()).isEqualByComparingTo("200");
        assertThat(comparison.periodBTotal()).isEqualByComparingTo("305");
        assertThat(comparison.movers()).extracting(PeriodComparison.Entry::groupValue)
                .containsExactly("AmazonEC2", "AmazonS3");
        assertThat(comparison.movers().get(0).percentageChange()).isEqualByComparingTo("50.0");
        assertThat(comparison.newInB()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.groupValue()).isEqualTo("AmazonRDS");
                    assertThat(entry.percentageChange()).isNull();
                });
        assertThat(comparison.disappearedFromA()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.groupValue()).isEqualTo("AWSLambda");
                    assertThat(entry.absoluteChange()).isEqualByComparingTo("-20");
                });
    }

    @Test
    void reversedPeriodIsRejected() {
        assertThatThrownBy(() -> service.compare(A_END, A_START, B_START, B_END, Dimension.SERVICE, 10))
                .isInstanceOf(InvalidDateRangeException.class)
                .hasMessageContaining("period_a_start");
    }

    private void save(LocalDate day, String productCode, double cost) {
        reader.save(new DailyCostSummary(day, "111111111111", productCode, "us-east-1", "cur", cost));
    }
}
