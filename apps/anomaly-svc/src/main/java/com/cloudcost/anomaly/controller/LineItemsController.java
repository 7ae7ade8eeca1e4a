package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.controller.dto.LineItemRequestDto;
import com.cloudcost.anomaly.controller.dto.LineItemsIngestRequestDto;
import com.cloudcost.anomaly.controller.dto.LineItemsIngestResponseDto;
import com.cloudcost.anomaly.model.LineItem;
import com.cloudcost.anomaly.service.CostIngestionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/line-items")
public class LineItemsController {

    private final CostIngestionService costIngestionService;

    public LineItemsController(CostIngestionService costIngestionService) {
        this.costIngestionService = costIngestionService;
    }

    @PostMapping
    public ResponseEntity<LineItemsIngestResponseDto> ingest(@Valid @RequestBody LineItemsIngestRequestDto request) {
        CostIngestionService.IngestResult result = costIngestionService.ingest(
                request.items().stream().map(LineItemsController::toLineItem).toList(),
                request.replaceExistingFlag());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new LineItemsIngestResponseDto(result.rowsLoaded(), result.rowsReplaced(), result.summaryRows(), result.traceId()));
    }

    private static LineItem toLineItem(LineItemRequestDto dto) {
        return new LineItem(
                dto.lineItemId(),
                dto.usageStartDate(),
                dto.payerAccountId(),
                dto.usageAccountId(),
                dto.productCode(),
                dto.region(),
                dto.usageType(),
                dto.operation(),
                dto.resourceId(),
                dto.lineItemType(),
                dto.unblendedCost(),
                dto.netAmortizedCost(),
                dto.usageAmount(),
                dto.currencyCode(),
                dto.dataSource()
        );
    }
}
