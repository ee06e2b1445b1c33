package com.flagship.journal_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One debit or credit leg of a journal entry. Immutable once written.
 */
@Value
public class JournalLine {
    UUID id;
    UUID journalEntryId;
    int lineNumber;
    UUID accountId;
    String description;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
}
