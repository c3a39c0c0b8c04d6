package com.flagship.mining_ledger.catalog;

import com.flagship.mining_ledger.catalog.dto.CatalogResponse;
import com.flagship.mining_ledger.catalog.dto.TierResponse;
import com.flagship.mining_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public, unauthenticated view of the catalog and the payment address.
 */
@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
public class CatalogController {

    private final EntitlementCatalog catalog;
    private final LedgerProperties properties;

    @GetMapping
    public CatalogResponse getConfig() {
        return new CatalogResponse(
            properties.getReceiveAddress(),
            catalog.topTier().getId(),
            catalog.tiers().stream().map(TierResponse::from).toList()
        );
    }
}
