package com.flagship.journal_ledger.journal.event;

import com.flagship.journal_ledger.journal.JournalEntry;
import com.flagship.journal_ledger.journal.JournalLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Published when an entry becomes POSTED and its lines start counting toward balances.
 *
 * Carries the account-level deltas so report caches can update without
 * reading the ledger back.
 */
@Value
public class JournalEntryPostedEvent implements JournalEvent {
    UUID eventId;
    UUID entryId;
    String entryNumber;
    String sourceType;
    Long sourceId;
    LocalDate entryDate;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    UUID reversalOfId;
    List<LineSummary> lines;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryPostedEvent fromEntry(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getSourceType().name(),
            entry.getSourceId(),
            entry.getEntryDate(),
            entry.getTotalDebit(),
            entry.getTotalCredit(),
            entry.getReversalOfId(),
            entry.getLines().stream().map(LineSummary::of).toList(),
            Instant.now()
        );
    }

    @Value
    public static class LineSummary {
        UUID accountId;
        BigDecimal debitAmount;
        BigDecimal creditAmount;

        static LineSummary of(JournalLine line) {
            return new LineSummary(line.getAccountId(), line.getDebitAmount(), line.getCreditAmount());
        }
    }
}
