package com.flagship.mining_ledger.withdrawal;

import com.flagship.mining_ledger.account.Account;
import lombok.Value;

/**
 * Result of a withdrawal request. {@code replayed} is true when an earlier
 * withdrawal with the same idempotency key was returned instead of debiting
 * again; {@code account} is the account as it stands after the request.
 */
@Value
public class WithdrawalOutcome {
    WithdrawalRecord record;
    Account account;
    boolean replayed;
}
