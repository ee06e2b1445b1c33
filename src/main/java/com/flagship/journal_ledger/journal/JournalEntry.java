package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.exception.LedgerStateException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A journal entry with its lines.
 *
 * State changes return a new instance and reject transitions the lifecycle
 * does not allow:
 * <pre>
 *   DRAFT --post--> POSTED --reverse--> REVERSED
 * </pre>
 * The database enforces the same rules with a trigger.
 */
@Value
public class JournalEntry {
    UUID id;
    String entryNumber;
    SourceType sourceType;
    Long sourceId;
    String reference;
    LocalDate entryDate;
    String description;
    JournalStatus status;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    String createdBy;
    Instant createdAt;
    Instant postedAt;
    UUID reversalOfId;
    UUID reversedById;
    Instant reversedAt;
    String reversedBy;
    String reversalReason;
    List<JournalLine> lines;

    /**
     * Transitions to POSTED. Only valid from DRAFT.
     *
     * @throws LedgerStateException if the entry is already posted or reversed
     */
    public JournalEntry post(Instant postedAt) {
        if (status == JournalStatus.POSTED) {
            throw new LedgerStateException(LedgerStateException.Reason.ALREADY_POSTED, id, status,
                String.format("Journal entry %s is already posted", entryNumber));
        }
        if (status == JournalStatus.REVERSED) {
            throw new LedgerStateException(LedgerStateException.Reason.ALREADY_REVERSED, id, status,
                String.format("Journal entry %s has been reversed and cannot be posted", entryNumber));
        }
        return new JournalEntry(id, entryNumber, sourceType, sourceId, reference, entryDate, description,
            JournalStatus.POSTED, totalDebit, totalCredit, createdBy, createdAt, postedAt,
            reversalOfId, reversedById, reversedAt, reversedBy, reversalReason, lines);
    }

    /**
     * Transitions to REVERSED. Only valid from POSTED.
     *
     * @throws LedgerStateException if the entry is a draft or already reversed
     */
    public JournalEntry markReversed(UUID reversalEntryId, String actor, String reason, Instant at) {
        if (status == JournalStatus.DRAFT) {
            throw new LedgerStateException(LedgerStateException.Reason.NOT_POSTED, id, status,
                String.format("Journal entry %s is a draft; only posted entries can be reversed", entryNumber));
        }
        if (status == JournalStatus.REVERSED) {
            throw new LedgerStateException(LedgerStateException.Reason.ALREADY_REVERSED, id, status,
                String.format("Journal entry %s is already reversed", entryNumber));
        }
        return new JournalEntry(id, entryNumber, sourceType, sourceId, reference, entryDate, description,
            JournalStatus.REVERSED, totalDebit, totalCredit, createdBy, createdAt, postedAt,
            reversalOfId, reversalEntryId, at, actor, reason, lines);
    }

    public boolean isBalanced(BigDecimal tolerance) {
        return totalDebit.subtract(totalCredit).abs().compareTo(tolerance) <= 0;
    }
}
