package com.flagship.mining_ledger.config;

import com.flagship.mining_ledger.catalog.EntitlementCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class CatalogConfig {

    @Bean
    public EntitlementCatalog entitlementCatalog(LedgerProperties properties) {
        EntitlementCatalog catalog = EntitlementCatalog.from(properties.getCatalog());
        log.info("Loaded entitlement catalog: tiers={}, topTier={}",
                catalog.tiers().size(), catalog.topTier().getId());
        return catalog;
    }
}
