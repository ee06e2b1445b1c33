package com.flagship.journal_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An account in the chart of accounts.
 *
 * {@code currentBalance} is the materialized running balance maintained by the
 * posting path. It is a cache of the journal: the journal lines remain the
 * source of truth and the balance can always be recomputed from them.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    boolean header;
    boolean active;
    BigDecimal currentBalance;
    Instant balanceUpdatedAt;

    public NormalBalance getNormalBalance() {
        return type.normalBalance();
    }

    /**
     * Whether journal lines may reference this account.
     */
    public boolean isPostable() {
        return active && !header;
    }
}
