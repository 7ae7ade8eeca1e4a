package com.cloudcost.anomaly.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cloudcost.anomaly.model.CostTrend;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.Granularity;
import com.cloudcost.anomaly.repository.DailyCostSummary;
import com.cloudcost.anomaly.repository.InMemoryDailyCostReader;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CostTrendServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 6, 3);
    private static final LocalDate SUNDAY_AFTER = LocalDate.of(2024, 6, 16);

    private final InMemoryDailyCostReader reader = new InMemoryDailyCostReader();
    private CostTrendService service;

    @BeforeEach
    void setUp() {
        service = new CostTrendService(reader, Clock.fixed(Instant.parse("2024-06-16T12:00:00Z"), ZoneOffset.UTC));
        for (LocalDate day = MONDAY; !day.isAfter(SUNDAY_AFTER); day = day.plusDays(1)) {
            double ec2 = day.equals(LocalDate.of(2024, 6, 12)) ? 24 : day.equals(LocalDate.of(2024, 6, 15)) ? 15 : 10;
            reader.save(new DailyCostSummary(day, "111111111111", "AmazonEC2", "us-east-1", "cur", ec2));
            reader.save(new DailyCostSummary(day, "111111111111", "AmazonS3", "us-east-1", "cur", 5));
        }
    }

    @Test
    void weeklyBucketsStartOnMonday() {
        CostTrend trend = service.getCostTrend(MONDAY, SUNDAY_AFTER, null, null, Granularity.WEEKLY);

        assertThat(trend.points()).extracting(CostTrend.Point::periodStart)
                .containsExactly(MONDAY, MONDAY.plusWeeks(1));
        assertThat(trend.points().get(0).cost()).isEqualByComparingTo("105");
        assertThat(trend.total()).isEqualByComparingTo("229");
        assertThat(trend.average()).isEqualByComparingTo("114.50");
        assertThat(trend.minCost()).isEqualByComparingTo("105");
        assertThat(trend.maxCost()).isEqualByComparingTo("124");
    }

    @Test
    void filterNarrowsToOneGroup() {
        CostTrend trend = service.getCostTrend(MONDAY, SUNDAY_AFTER, Dimension.SERVICE, "AmazonS3", Granularity.DAILY);

        assertThat(trend.points()).hasSize(14)
                .allSatisfy(point -> {
                    assertThat(point.groupValue()).isEqualTo("AmazonS3");
                    assertThat(point.cost()).isEqualByComparingTo("5");
                });
        assertThat(trend.total()).isEqualByComparingTo("70");
    }

    @Test
    void monthlyCollapsesToFirstOfMonth() {
        CostTrend trend = service.getCostTrend(MONDAY, SUNDAY_AFTER, Dimension.SERVICE, null, Granularity.MONTHLY);

        assertThat(trend.points()).extracting(CostTrend.Point::periodStart)
                .containsOnly(LocalDate.of(2024, 6, 1));
        assertThat(trend.points()).extracting(CostTrend.Point::groupValue)
                .containsExactly("AmazonEC2", "AmazonS3");
    }

    @Test
    void emptyRangeYieldsZeroSummary() {
        CostTrend trend = service.getCostTrend(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 31), null, null, null);

        assertThat(trend.points()).isEmpty();
        assertThat(trend.granularity()).isEqualTo(Granularity.DAILY);
        assertThat(trend.total()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void filterWithoutGroupingIsRejected() {
        assertThatThrownBy(() -> service.getCostTrend(MONDAY, SUNDAY_AFTER, null, "AmazonS3", Granularity.DAILY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("group_by");
    }

    @Test
    void reversedRangeIsRejected() {
        assertThatThrownBy(() -> service.getCostTrend(SUNDAY_AFTER, MONDAY, null, null, Granularity.DAILY))
                .isInstanceOf(InvalidDateRangeException.class);
    }

    @Test
    void dailyChangesTrackTopGroups() {
        List<CostTrend.DailyChange> changes = service.getDailyChanges(3, Dimension.SERVICE, 1, null);

        assertThat(changes).extracting(CostTrend.DailyChange::groupValue).containsOnly("AmazonEC2");
        assertThat(changes).hasSize(4);
        assertThat(changes.get(0).costChange()).isNull();
        assertThat(changes.get(2).costChange()).isEqualByComparingTo("5");
        assertThat(changes.get(2).pctChange()).isEqualByComparingTo("50");
        assertThat(changes.get(3).pctChange()).isEqualByComparingTo("-33.33");
    }
}
