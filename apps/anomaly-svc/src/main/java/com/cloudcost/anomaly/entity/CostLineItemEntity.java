package com.cloudcost.anomaly.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "cost_line_items")
public class CostLineItemEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "line_item_id")
    private String lineItemId;

    @Column(name = "usage_start_date", nullable = false)
    private LocalDateTime usageStartDate;

    @Column(name = "payer_account_id")
    private String payerAccountId;

    @Column(name = "usage_account_id")
    private String usageAccountId;

    @Column(name = "product_code")
    private String productCode;

    @Column(name = "region")
    private String region;

    @Column(name = "usage_type")
    private String usageType;

    @Column(name = "operation")
    private String operation;

    @Column(name = "resource_id")
    private String resourceId;

    @Column(name = "line_item_type", nullable = false)
    private String lineItemType;

    @Column(name = "unblended_cost", nullable = false, precision = 18, scale = 8)
    private BigDecimal unblendedCost;

    @Column(name = "net_amortized_cost", precision = 18, scale = 8)
    private BigDecimal netAmortizedCost;

    @Column(name = "usage_amount", precision = 18, scale = 8)
    private BigDecimal usageAmount;

    @Column(name = "currency_code")
    private String currencyCode;

    @Column(name = "data_source", nullable = false)
    private String dataSource;

    @Column(name = "ingested_at", nullable = false)
    private LocalDateTime ingestedAt;

    protected CostLineItemEntity() {
    }

    public CostLineItemEntity(UUID id, String lineItemId, LocalDateTime usageStartDate, String payerAccountId,
                              String usageAccountId, String productCode, String region, String usageType,
                              String operation, String resourceId, String lineItemType, BigDecimal unblendedCost,
                              BigDecimal netAmortizedCost, BigDecimal usageAmount, String currencyCode,
                              String dataSource, LocalDateTime ingestedAt) {
        this.id = id;
        this.lineItemId = lineItemId;
        this.usageStartDate = usageStartDate;
        this.payerAccountId = payerAccountId;
        this.usageAccountId = usageAccountId;
        this.productCode = productCode;
        this.region = region;
        this.usageType = usageType;
        this.operation = operation;
        this.resourceId = resourceId;
        this.lineItemType = lineItemType;
        this.unblendedCost = unblendedCost;
        this.netAmortizedCost = netAmortizedCost;
        this.usageAmount = usageAmount;
        this.currencyCode = currencyCode;
        this.dataSource = dataSource;
        this.ingestedAt = ingestedAt;
    }

    public UUID getId() { return id; }
    public String getLineItemId() { return lineItemId; }
    public LocalDateTime getUsageStartDate() { return usageStartDate; }
    public String getPayerAccountId() { return payerAccountId; }
    public String getUsageAccountId() { return usageAccountId; }
    public String getProductCode() { return productCode; }
    public String getRegion() { return region; }
    public String getUsageType() { return usageType; }
    public String getOperation() { return operation; }
    public String getResourceId() { return resourceId; }
    public String getLineItemType() { return lineItemType; }
    public BigDecimal getUnblendedCost() { return unblendedCost; }
    public BigDecimal getNetAmortizedCost() { return netAmortizedCost; }
    public BigDecimal getUsageAmount() { return usageAmount; }
    public String getCurrencyCode() { return currencyCode; }
    public String getDataSource() { return dataSource; }
    public LocalDateTime getIngestedAt() { return ingestedAt; }
}
