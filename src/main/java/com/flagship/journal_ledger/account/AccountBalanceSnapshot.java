package com.flagship.journal_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time view of an account's materialized balance.
 */
@Value
public class AccountBalanceSnapshot {
    UUID accountId;
    String code;
    BigDecimal currentBalance;
    Instant lastUpdated;
}
