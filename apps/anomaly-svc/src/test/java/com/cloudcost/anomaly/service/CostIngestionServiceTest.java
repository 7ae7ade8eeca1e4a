package com.cloudcost.anomaly.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cloudcost.anomaly.entity.CostLineItemEntity;
import com.cloudcost.anomaly.model.LineItem;
import com.cloudcost.anomaly.repository.DailySummaryRebuilder;
import com.cloudcost.anomaly.repository.JpaCostLineItemRepository;
import com.cloudcost.anomaly.tracing.RequestContextHolder;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CostIngestionServiceTest {

    @Mock
    private JpaCostLineItemRepository lineItemRepository;

    @Mock
    private DailySummaryRebuilder dailySummaryRebuilder;

    private CostIngestionService service;
    private final Clock clock = Clock.fixed(Instant.parse("2024-06-20T09:30:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        service = new CostIngestionService(lineItemRepository, dailySummaryRebuilder, clock);
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    @SuppressWarnings("unchecked")
    void persistsItemsAndRebuildsSummary() {
        when(dailySummaryRebuilder.rebuild()).thenReturn(2);
        RequestContextHolder.set(new RequestContextHolder.RequestContext("trace-123"));

        CostIngestionService.IngestResult result = service.ingest(List.of(
                item(LocalDateTime.of(2024, 6, 1, 0, 0), "cur"),
                item(LocalDateTime.of(2024, 6, 2, 0, 0), "cur")), false);

        ArgumentCaptor<List<CostLineItemEntity>> captor = ArgumentCaptor.forClass(List.class);
        verify(lineItemRepository).saveAllAndFlush(captor.capture());
        assertThat(captor.getValue()).hasSize(2)
                .allSatisfy(entity -> {
                    assertThat(entity.getIngestedAt()).isEqualTo(LocalDateTime.of(2024, 6, 20, 9, 30));
                    assertThat(entity.getProductCode()).isEqualTo("AmazonEC2");
                });
        verify(lineItemRepository, never()).deleteByRangeAndDataSource(any(), any(), anyString());
        assertThat(result.rowsLoaded()).isEqualTo(2);
        assertThat(result.rowsReplaced()).isZero();
        assertThat(result.summaryRows()).isEqualTo(2);
        assertThat(result.traceId()).isEqualTo("trace-123");
    }

    @Test
    void replaceDeletesCoveredDaysPerSource() {
        when(lineItemRepository.deleteByRangeAndDataSource(
                LocalDateTime.of(2024, 6, 1, 0, 0), LocalDateTime.of(2024, 6, 4, 0, 0), "cur")).thenReturn(5);
        when(lineItemRepository.deleteByRangeAndDataSource(
                LocalDateTime.of(2024, 6, 2, 0, 0), LocalDateTime.of(2024, 6, 3, 0, 0), "cost_explorer")).thenReturn(1);

        CostIngestionService.IngestResult result = service.ingest(List.of(
                item(LocalDateTime.of(2024, 6, 3, 13, 0), "cur"),
                item(LocalDateTime.of(2024, 6, 1, 4, 0), "cur"),
                item(LocalDateTime.of(2024, 6, 2, 0, 0), "cost_explorer")), true);

        assertThat(result.rowsReplaced()).isEqualTo(6);
        assertThat(result.traceId()).isNull();
    }

    @Test
    void emptyBatchIsRejected() {
        assertThatThrownBy(() -> service.ingest(List.of(), false))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(lineItemRepository, dailySummaryRebuilder);
    }

    @Test
    void lineItemValidatesRequiredFields() {
        assertThatThrownBy(() -> new LineItem(null, null, null, null, null, null, null, null, null,
                "Usage", BigDecimal.ONE, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("usageStartDate");
        assertThatThrownBy(() -> item(LocalDateTime.of(2024, 6, 1, 0, 0), "billing_conductor"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dataSource");
        assertThat(item(LocalDateTime.of(2024, 6, 1, 0, 0), null).dataSource()).isEqualTo(LineItem.SOURCE_CUR);
    }

    private static LineItem item(LocalDateTime usageStart, String dataSource) {
        return new LineItem("li-" + usageStart, usageStart, "999999999999", "111111111111", "AmazonEC2",
                "us-east-1", "BoxUsage:m5.large", "RunInstances", "i-0abc", "Usage",
                new BigDecimal("12.50"), new BigDecimal("11.00"), BigDecimal.ONE, "USD", dataSource);
    }
}
