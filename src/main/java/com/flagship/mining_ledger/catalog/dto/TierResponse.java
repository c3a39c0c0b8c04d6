package com.flagship.mining_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.catalog.EntitlementTier;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TierResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("mining_amount")
    BigDecimal miningAmount;

    @JsonProperty("duration_days")
    long durationDays;

    @JsonProperty("duration_seconds")
    long durationSeconds;

    @JsonProperty("gb")
    int gb;

    public static TierResponse from(EntitlementTier tier) {
        return TierResponse.builder()
            .id(tier.getId())
            .name(tier.getName())
            .price(tier.getCost())
            .miningAmount(tier.getPayout())
            .durationDays(tier.getDuration().toDays())
            .durationSeconds(tier.getDuration().getSeconds())
            .gb(tier.getCapacityGb())
            .build();
    }
}
