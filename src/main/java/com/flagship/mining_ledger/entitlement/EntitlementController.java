package com.flagship.mining_ledger.entitlement;

import com.flagship.mining_ledger.catalog.EntitlementCatalog;
import com.flagship.mining_ledger.catalog.EntitlementTier;
import com.flagship.mining_ledger.entitlement.dto.NodeStatusResponse;
import com.flagship.mining_ledger.entitlement.dto.PurchaseRequest;
import com.flagship.mining_ledger.entitlement.dto.PurchaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/nodes")
@RequiredArgsConstructor
@Slf4j
public class EntitlementController {

    private final EntitlementService entitlementService;
    private final EntitlementCatalog catalog;

    /**
     * Settles matured instances, then reports every tier for the caller.
     */
    @GetMapping
    public NodeStatusResponse getNodes(@AuthenticationPrincipal UUID accountId) {
        return NodeStatusResponse.from(entitlementService.status(accountId));
    }

    @PostMapping("/purchase")
    public ResponseEntity<PurchaseResponse> purchase(@AuthenticationPrincipal UUID accountId,
                                                     @Valid @RequestBody PurchaseRequest request) {
        log.info("Received purchase request: nodeId={}", request.getNodeId());

        Entitlement entitlement = entitlementService.purchase(accountId, request.getNodeId(),
                request.getTransactionHash());
        String tierName = catalog.find(entitlement.getTierId())
                .map(EntitlementTier::getName)
                .orElse(entitlement.getTierId());

        return ResponseEntity.status(HttpStatus.CREATED).body(PurchaseResponse.from(entitlement, tierName));
    }
}
