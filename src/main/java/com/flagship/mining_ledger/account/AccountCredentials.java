package com.flagship.mining_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * Stored credential of an account, as needed to check a login.
 */
@Value
public class AccountCredentials {
    UUID accountId;
    String passwordHash;
}
