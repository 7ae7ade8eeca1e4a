package com.cloudcost.anomaly.service;

import com.cloudcost.anomaly.entity.CostLineItemEntity;
import com.cloudcost.anomaly.model.LineItem;
import com.cloudcost.anomaly.repository.DailySummaryRebuilder;
import com.cloudcost.anomaly.repository.JpaCostLineItemRepository;
import com.cloudcost.anomaly.tracing.RequestContextHolder;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CostIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CostIngestionService.class);

    public record IngestResult(int rowsLoaded, int rowsReplaced, int summaryRows, String traceId) {
    }

    private final JpaCostLineItemRepository lineItemRepository;
    private final DailySummaryRebuilder dailySummaryRebuilder;
    private final Clock clock;

    @Autowired
    public CostIngestionService(JpaCostLineItemRepository lineItemRepository, DailySummaryRebuilder dailySummaryRebuilder) {
        this(lineItemRepository, dailySummaryRebuilder, Clock.systemUTC());
    }

    CostIngestionService(JpaCostLineItemRepository lineItemRepository, DailySummaryRebuilder dailySummaryRebuilder, Clock clock) {
        this.lineItemRepository = lineItemRepository;
        this.dailySummaryRebuilder = dailySummaryRebuilder;
        this.clock = clock;
    }

    /**
     * Persists the items and rebuilds the daily summary. With {@code replaceExisting}, stored items
     * of the same data source on the days covered by the batch are deleted first, so re-sending a
     * corrected day does not double count it.
     */
    @Transactional
    public IngestResult ingest(List<LineItem> items, boolean replaceExisting) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("at least one line item must be provided");
        }
        int replaced = replaceExisting ? deleteCoveredDays(items) : 0;
        LocalDateTime ingestedAt = LocalDateTime.now(clock);
        List<CostLineItemEntity> entities = items.stream()
                .map(item -> toEntity(item, ingestedAt))
                .toList();
        lineItemRepository.saveAllAndFlush(entities);
        int summaryRows = dailySummaryRebuilder.rebuild();
        String traceId = RequestContextHolder.get()
                .map(RequestContextHolder.RequestContext::traceId)
                .orElse(null);
        log.info("Ingested {} line items ({} replaced), daily summary now {} rows", entities.size(), replaced, summaryRows);
        return new IngestResult(entities.size(), replaced, summaryRows, traceId);
    }

    private int deleteCoveredDays(List<LineItem> items) {
        Map<String, List<LocalDate>> daysBySource = items.stream()
                .collect(Collectors.groupingBy(LineItem::dataSource,
                        Collectors.mapping(item -> item.usageStartDate().toLocalDate(), Collectors.toList())));
        int removed = 0;
        for (Map.Entry<String, List<LocalDate>> entry : daysBySource.entrySet()) {
            LocalDate first = entry.getValue().stream().min(Comparator.naturalOrder()).orElseThrow();
            LocalDate last = entry.getValue().stream().max(Comparator.naturalOrder()).orElseThrow();
            removed += lineItemRepository.deleteByRangeAndDataSource(
                    first.atStartOfDay(), last.plusDays(1).atStartOfDay(), entry.getKey());
        }
        return removed;
    }

    private CostLineItemEntity toEntity(LineItem item, LocalDateTime ingestedAt) {
        return new CostLineItemEntity(
                UUID.randomUUID(),
                item.lineItemId(),
                item.usageStartDate(),
                item.payerAccountId(),
                item.usageAccountId(),
                item.productCode(),
                item.region(),
                item.usageType(),
                item.operation(),
                item.resourceId(),
                item.lineItemType(),
                item.unblendedCost(),
                item.netAmortizedCost(),
                item.usageAmount(),
                item.currencyCode(),
                item.dataSource(),
                ingestedAt
        );
    }
}
