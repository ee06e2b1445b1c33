package com.flagship.journal_ledger.report;

import com.flagship.journal_ledger.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One row of a balance report. Header rows carry the sum of their descendants.
 */
@Value
public class AccountBalanceLine {
    UUID accountId;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    boolean header;
    BigDecimal debitTotal;
    BigDecimal creditTotal;
    BigDecimal balance;
}
