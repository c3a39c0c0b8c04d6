package com.flagship.mining_ledger.referral;

import com.flagship.mining_ledger.referral.dto.ReferralReportResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/referrals")
@RequiredArgsConstructor
public class ReferralController {

    private final ReferralService referralService;

    @GetMapping
    public ReferralReportResponse getReferrals(@AuthenticationPrincipal UUID accountId) {
        return ReferralReportResponse.from(referralService.report(accountId));
    }
}
