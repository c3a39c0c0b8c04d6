package com.flagship.mining_ledger.entitlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.entitlement.Entitlement;
import com.flagship.mining_ledger.entitlement.EntitlementStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("message")
    String message;

    @JsonProperty("entitlement_id")
    UUID entitlementId;

    @JsonProperty("node_id")
    String nodeId;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("mining_amount")
    BigDecimal miningAmount;

    @JsonProperty("status")
    EntitlementStatus status;

    @JsonProperty("purchase_time")
    Instant purchaseTime;

    @JsonProperty("matures_at")
    Instant maturesAt;

    public static PurchaseResponse from(Entitlement entitlement, String tierName) {
        return PurchaseResponse.builder()
            .success(true)
            .message(tierName + " purchased successfully")
            .entitlementId(entitlement.getId())
            .nodeId(entitlement.getTierId())
            .price(entitlement.getCost())
            .miningAmount(entitlement.getPayout())
            .status(entitlement.getStatus())
            .purchaseTime(entitlement.getPurchasedAt())
            .maturesAt(entitlement.maturesAt())
            .build();
    }
}
