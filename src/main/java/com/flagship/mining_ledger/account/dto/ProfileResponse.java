package com.flagship.mining_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ProfileResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("username")
    String username;

    @JsonProperty("refer_code")
    String referCode;

    @JsonProperty("mine_balance")
    BigDecimal mineBalance;

    @JsonProperty("referral_balance")
    BigDecimal referralBalance;

    @JsonProperty("has_purchased_node")
    boolean hasPurchasedNode;

    @JsonProperty("has_purchased_node4")
    boolean hasPurchasedTopNode;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ProfileResponse from(Account account) {
        return ProfileResponse.builder()
            .id(account.getId())
            .username(account.getUsername())
            .referCode(account.getReferralCode())
            .mineBalance(account.getEarnedBalance())
            .referralBalance(account.getReferralBalance())
            .hasPurchasedNode(account.isAnyEntitlementPurchased())
            .hasPurchasedTopNode(account.isTopTierEntitlementPurchased())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
