package com.flagship.journal_ledger.report;

import com.flagship.journal_ledger.account.NormalBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * The general ledger of one account over a date range.
 */
@Value
public class AccountLedger {
    UUID accountId;
    String code;
    String name;
    NormalBalance normalBalance;
    LocalDate from;
    LocalDate to;
    BigDecimal openingBalance;
    List<AccountLedgerLine> lines;
    BigDecimal closingBalance;
}
