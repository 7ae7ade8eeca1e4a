package com.cloudcost.anomaly.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.cloudcost.anomaly.model.DailyCostRow;
import com.cloudcost.anomaly.model.Dimension;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDailyCostReaderTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);

    private final InMemoryDailyCostReader reader = new InMemoryDailyCostReader();

    @BeforeEach
    void setUp() {
        reader.saveAll(List.of(
                new DailyCostSummary(DAY, "111111111111", "AmazonEC2", "us-east-1", "cur", 10),
                new DailyCostSummary(DAY, "111111111111", "AmazonEC2", "eu-west-1", "cur", 5),
                new DailyCostSummary(DAY, "222222222222", "AmazonEC2", "us-east-1", "cur", 7),
                new DailyCostSummary(DAY, "111111111111", "AmazonS3", "us-east-1", "cost_explorer", 3),
                new DailyCostSummary(DAY.plusDays(5), "111111111111", "AmazonEC2", "us-east-1", "cur", 99)));
    }

    @Test
    void sumsAcrossDimensionsNotGroupedBy() {
        List<DailyCostRow> rows = reader.readDailyCosts(DailyCostQuery.of(DAY, DAY, List.of(Dimension.SERVICE), null));

        assertThat(rows).extracting(DailyCostRow::groupValue, DailyCostRow::dailyCost)
                .containsExactlyInAnyOrder(
                        tuple("AmazonEC2", 22d),
                        tuple("AmazonS3", 3d));
    }

    @Test
    void appliesSourceAndDimensionFilters() {
        DailyCostQuery query = DailyCostQuery.of(DAY, DAY.plusDays(10), List.of(Dimension.REGION), "cur")
                .withFilter(Dimension.ACCOUNT, "111111111111")
                .withFilter(Dimension.SERVICE, " ");

        List<DailyCostRow> rows = reader.readDailyCosts(query);

        assertThat(rows).hasSize(3);
        assertThat(rows).extracting(DailyCostRow::groupValue).containsOnly("us-east-1", "eu-west-1");
    }

    @Test
    void emptyGroupingGivesDailyTotals() {
        List<DailyCostRow> rows = reader.readDailyCosts(DailyCostQuery.of(DAY, DAY, List.of(), null));

        assertThat(rows).singleElement().satisfies(row -> assertThat(row.dailyCost()).isEqualTo(25d));
    }
}
