package com.cloudcost.anomaly.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.cloudcost.anomaly.model.Anomaly;
import com.cloudcost.anomaly.model.AnomalyKind;
import com.cloudcost.anomaly.model.Dimension;
import com.cloudcost.anomaly.model.PointAnomaly;
import com.cloudcost.anomaly.model.TrendAnomaly;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class StreakTableTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 6, 1);
    private static final LocalDate DAY_2 = DAY_1.plusDays(1);
    private static final LocalDate DAY_3 = DAY_1.plusDays(2);

    @Test
    void keepsMostExtremeDetectionOfStreak() {
        StreakTable table = new StreakTable();
        table.advance(DAY_1, List.of(point("AmazonEC2", DAY_1, 3.1)));
        table.advance(DAY_2, List.of(point("AmazonEC2", DAY_2, -6.0)));
        table.advance(DAY_3, List.of(point("AmazonEC2", DAY_3, 4.0)));

        assertThat(table.lastSeen(new Anomaly.StreakKey("AmazonEC2", AnomalyKind.POINT)))
                .contains(DAY_3);
        List<Anomaly> events = table.flush();

        assertThat(events).hasSize(1);
        assertThat(events.get(0).usageDate()).isEqualTo(DAY_2);
        assertThat(events.get(0).zScore()).isEqualTo(-6.0);
    }

    @Test
    void gapClosesStreak() {
        StreakTable table = new StreakTable();
        table.advance(DAY_1, List.of(point("AmazonEC2", DAY_1, 5.0)));
        table.advance(DAY_2, List.of());
        assertThat(table.activeCount()).isZero();
        table.advance(DAY_3, List.of(point("AmazonEC2", DAY_3, 3.0)));

        assertThat(table.flush()).extracting(Anomaly::usageDate).containsExactly(DAY_1, DAY_3);
    }

    @Test
    void pointAndTrendOfSameGroupAreTrackedSeparately() {
        StreakTable table = new StreakTable();
        table.advance(DAY_1, List.of(
                point("AmazonEC2", DAY_1, 5.0),
                new TrendAnomaly(DAY_1, List.of(Dimension.SERVICE), "AmazonEC2", 200, 100, 5, 0.6)));

        assertThat(table.activeCount()).isEqualTo(2);
        assertThat(table.flush()).hasSize(2);
    }

    private static PointAnomaly point(String group, LocalDate day, double zScore) {
        return new PointAnomaly(day, List.of(Dimension.SERVICE), group, 500, 100, 10, zScore);
    }
}
