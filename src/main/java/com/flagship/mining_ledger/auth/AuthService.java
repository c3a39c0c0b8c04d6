package com.flagship.mining_ledger.auth;

import com.flagship.mining_ledger.account.Account;
import com.flagship.mining_ledger.account.AccountCredentials;
import com.flagship.mining_ledger.account.AccountLedgerService;
import com.flagship.mining_ledger.config.LedgerProperties;
import com.flagship.mining_ledger.entitlement.EntitlementService;
import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import com.flagship.mining_ledger.referral.ReferralService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Signup and login. Raw passwords stop here: the ledger only ever sees the
 * BCrypt hash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final AccountLedgerService ledger;
    private final ReferralService referralService;
    private final EntitlementService entitlementService;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final LedgerProperties properties;

    /**
     * Opens the account and links the referral in one transaction: an
     * unknown referral code leaves no account behind.
     *
     * @throws LedgerException DUPLICATE_ACCOUNT or INVALID_REFERRAL_CODE
     */
    @Transactional
    public AuthSession signup(String username, String rawPassword, String referralCode) {
        String normalized = username.trim();
        Account account = ledger.openAccount(normalized, passwordEncoder.encode(rawPassword),
                properties.getSignupBonus());

        if (referralCode != null && !referralCode.isBlank()) {
            referralService.link(referralCode, account.getId());
        }

        log.info("Signup completed: accountId={}, referred={}", account.getId(),
                referralCode != null && !referralCode.isBlank());
        return new AuthSession(jwtService.generateToken(account.getId()), account);
    }

    /**
     * @throws LedgerException INVALID_CREDENTIALS for an unknown username or a
     *                         wrong password, without saying which
     */
    @Transactional
    public AuthSession login(String username, String rawPassword) {
        AccountCredentials credentials = ledger.findCredentials(username.trim())
                .filter(c -> passwordEncoder.matches(rawPassword, c.getPasswordHash()))
                .orElseThrow(() -> new LedgerException(ErrorKind.INVALID_CREDENTIALS, "Invalid credentials"));

        entitlementService.settleMatured(credentials.getAccountId());
        Account account = ledger.read(credentials.getAccountId());

        log.info("Login succeeded: accountId={}", account.getId());
        return new AuthSession(jwtService.generateToken(account.getId()), account);
    }
}
