package com.flagship.mining_ledger.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.referral.ReferralReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReferralReportResponse {

    @JsonProperty("refer_code")
    String referCode;

    @JsonProperty("valid_referrals")
    List<ReferralEntry> validReferrals;

    @JsonProperty("invalid_referrals")
    List<ReferralEntry> invalidReferrals;

    @JsonProperty("total_earned")
    BigDecimal totalEarned;

    public static ReferralReportResponse from(ReferralReport report) {
        return ReferralReportResponse.builder()
            .referCode(report.getReferralCode())
            .validReferrals(report.getValidReferrals().stream().map(ReferralEntry::from).toList())
            .invalidReferrals(report.getInvalidReferrals().stream().map(ReferralEntry::from).toList())
            .totalEarned(report.getTotalEarned())
            .build();
    }

    @Value
    public static class ReferralEntry {

        @JsonProperty("username")
        String username;

        @JsonProperty("joined_at")
        Instant joinedAt;

        @JsonProperty("is_valid")
        boolean valid;

        static ReferralEntry from(ReferralReport.Entry entry) {
            return new ReferralEntry(entry.getUsername(), entry.getJoinedAt(), entry.isValid());
        }
    }
}
