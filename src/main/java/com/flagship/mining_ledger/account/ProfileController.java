package com.flagship.mining_ledger.account;

import com.flagship.mining_ledger.account.dto.ProfileResponse;
import com.flagship.mining_ledger.entitlement.EntitlementService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/user")
@RequiredArgsConstructor
public class ProfileController {

    private final EntitlementService entitlementService;

    /**
     * Settles matured entitlements first, so the balances returned already
     * include every payout that is due.
     */
    @GetMapping("/profile")
    public ProfileResponse getProfile(@AuthenticationPrincipal UUID accountId) {
        return ProfileResponse.from(entitlementService.settledAccount(accountId));
    }
}
