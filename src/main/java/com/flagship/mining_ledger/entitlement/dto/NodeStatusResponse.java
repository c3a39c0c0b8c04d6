package com.flagship.mining_ledger.entitlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.catalog.dto.TierResponse;
import com.flagship.mining_ledger.entitlement.TierStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-tier status keyed by tier id, in catalog order.
 */
@Value
public class NodeStatusResponse {

    @JsonProperty("nodes")
    Map<String, NodeStatus> nodes;

    public static NodeStatusResponse from(List<TierStatus> statuses) {
        Map<String, NodeStatus> nodes = new LinkedHashMap<>();
        for (TierStatus status : statuses) {
            nodes.put(status.getTier().getId(), NodeStatus.from(status));
        }
        return new NodeStatusResponse(nodes);
    }

    @Value
    @Builder
    public static class NodeStatus {

        @JsonProperty("config")
        TierResponse config;

        @JsonProperty("owned")
        boolean owned;

        @JsonProperty("active")
        boolean active;

        @JsonProperty("progress")
        double progress;

        @JsonProperty("can_rebuy")
        boolean canRebuy;

        @JsonProperty("entitlement_id")
        UUID entitlementId;

        @JsonProperty("purchase_time")
        Instant purchaseTime;

        static NodeStatus from(TierStatus status) {
            return NodeStatus.builder()
                .config(TierResponse.from(status.getTier()))
                .owned(status.isOwned())
                .active(status.isActive())
                .progress(status.getProgress())
                .canRebuy(status.isCanRebuy())
                .entitlementId(status.getEntitlementId())
                .purchaseTime(status.getPurchasedAt())
                .build();
        }
    }
}
