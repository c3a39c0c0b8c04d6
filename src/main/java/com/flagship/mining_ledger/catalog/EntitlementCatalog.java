package com.flagship.mining_ledger.catalog;

import com.flagship.mining_ledger.config.LedgerProperties;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable tier table.
 *
 * Built once from configuration at startup and injected wherever tiers are
 * needed. Iteration order is the configured order, which is also the display
 * order of the node status report.
 */
public final class EntitlementCatalog {

    private final Map<String, EntitlementTier> tiers;
    private final String topTierId;

    public EntitlementCatalog(Collection<EntitlementTier> tiers, String topTierId) {
        Objects.requireNonNull(tiers, "tiers");
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("Catalog must contain at least one tier");
        }
        Map<String, EntitlementTier> byId = new LinkedHashMap<>();
        for (EntitlementTier tier : tiers) {
            validate(tier);
            if (byId.putIfAbsent(tier.getId(), tier) != null) {
                throw new IllegalArgumentException("Duplicate tier id: " + tier.getId());
            }
        }
        if (topTierId == null || !byId.containsKey(topTierId)) {
            throw new IllegalArgumentException("Top tier '" + topTierId + "' is not in the catalog");
        }
        this.tiers = Collections.unmodifiableMap(byId);
        this.topTierId = topTierId;
    }

    public static EntitlementCatalog from(LedgerProperties.Catalog config) {
        return new EntitlementCatalog(
            config.getTiers().stream()
                .map(t -> new EntitlementTier(t.getId(), t.getName(), t.getCost(), t.getPayout(),
                        t.getDuration(), t.getCapacityGb()))
                .toList(),
            config.getTopTier()
        );
    }

    public Optional<EntitlementTier> find(String tierId) {
        if (tierId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tiers.get(tierId));
    }

    public Collection<EntitlementTier> tiers() {
        return tiers.values();
    }

    public EntitlementTier topTier() {
        return tiers.get(topTierId);
    }

    public boolean isTopTier(String tierId) {
        return topTierId.equals(tierId);
    }

    private static void validate(EntitlementTier tier) {
        if (tier.getId() == null || tier.getId().isBlank()) {
            throw new IllegalArgumentException("Tier id is required");
        }
        if (tier.getCost() == null || tier.getCost().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Tier " + tier.getId() + " must have a positive cost");
        }
        if (tier.getPayout() == null || tier.getPayout().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Tier " + tier.getId() + " must have a positive payout");
        }
        if (tier.getDuration() == null || tier.getDuration().isNegative() || tier.getDuration().isZero()) {
            throw new IllegalArgumentException("Tier " + tier.getId() + " must have a positive duration");
        }
    }
}
