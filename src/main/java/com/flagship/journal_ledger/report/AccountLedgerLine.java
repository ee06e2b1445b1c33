package com.flagship.journal_ledger.report;

import com.flagship.journal_ledger.journal.JournalStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class AccountLedgerLine {
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    JournalStatus status;
    String entryDescription;
    String lineDescription;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    /** Balance after this line. Draft lines leave it unchanged. */
    BigDecimal runningBalance;
}
