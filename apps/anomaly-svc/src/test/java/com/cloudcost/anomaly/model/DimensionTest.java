package com.cloudcost.anomaly.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DimensionTest {

    @Test
    void parsesShortKeysAndColumnNames() {
        assertThat(Dimension.parseGrouping("service+account"))
                .containsExactly(Dimension.SERVICE, Dimension.ACCOUNT);
        assertThat(Dimension.parseGrouping("Product_Code+region"))
                .containsExactly(Dimension.SERVICE, Dimension.REGION);
    }

    @Test
    void rejectsUnknownDuplicateAndBlankGroupings() {
        assertThatThrownBy(() -> Dimension.parseGrouping("service+flavor"))
                .isInstanceOf(InvalidGroupingException.class)
                .hasMessageContaining("flavor");
        assertThatThrownBy(() -> Dimension.parseGrouping("region+region"))
                .isInstanceOf(InvalidGroupingException.class);
        assertThatThrownBy(() -> Dimension.parseGrouping(" "))
                .isInstanceOf(InvalidGroupingException.class);
    }

    @Test
    void labelJoinsKeysInOrder() {
        assertThat(Dimension.label(List.of(Dimension.ACCOUNT, Dimension.SERVICE))).isEqualTo("account+service");
    }

    @Test
    void groupValueReplacesMissingParts() {
        DailyCostRow row = new DailyCostRow(Arrays.asList("AmazonEC2", null, " "), LocalDate.of(2024, 6, 1), 1.0);

        assertThat(row.groupValue()).isEqualTo("AmazonEC2 / unknown / unknown");
    }
}
