package com.flagship.mining_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code ledger.*} configuration tree.
 *
 * Bound once at startup. The catalog part is copied into an immutable
 * {@link com.flagship.mining_ledger.catalog.EntitlementCatalog}; nothing reads
 * the tier list from here afterwards.
 */
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    private BigDecimal signupBonus = new BigDecimal("25");

    private BigDecimal referralReward = new BigDecimal("50");

    private String receiveAddress;

    private Withdrawal withdrawal = new Withdrawal();

    private PaymentVerification paymentVerification = new PaymentVerification();

    private Catalog catalog = new Catalog();

    @Data
    public static class Withdrawal {
        private BigDecimal earnedMinimum = new BigDecimal("25");
        private BigDecimal referralMinimum = new BigDecimal("50");
    }

    @Data
    public static class PaymentVerification {
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Catalog {
        private String topTier;
        private List<Tier> tiers = new ArrayList<>();
    }

    @Data
    public static class Tier {
        private String id;
        private String name;
        private BigDecimal cost;
        private BigDecimal payout;
        private Duration duration;
        private int capacityGb;
    }
}
