package com.flagship.mining_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class CatalogResponse {

    @JsonProperty("receive_address")
    String receiveAddress;

    @JsonProperty("top_tier")
    String topTier;

    @JsonProperty("nodes")
    List<TierResponse> nodes;
}
