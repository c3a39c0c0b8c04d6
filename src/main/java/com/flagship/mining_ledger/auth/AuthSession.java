package com.flagship.mining_ledger.auth;

import com.flagship.mining_ledger.account.Account;
import lombok.Value;

/**
 * A freshly issued token together with the account it was issued for.
 */
@Value
public class AuthSession {
    String token;
    Account account;
}
