package com.flagship.mining_ledger.entitlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseRequest {

    @NotBlank(message = "Node id is required")
    @JsonProperty("node_id")
    private String nodeId;

    @NotBlank(message = "Transaction hash is required")
    @JsonProperty("transaction_hash")
    private String transactionHash;
}
