package com.flagship.journal_ledger.journal.event;

import com.flagship.journal_ledger.journal.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a posted entry is reversed. The reversal entry itself is
 * announced separately by a {@link JournalEntryPostedEvent}.
 */
@Value
public class JournalEntryReversedEvent implements JournalEvent {
    UUID eventId;
    UUID entryId;
    String entryNumber;
    UUID reversalEntryId;
    String reversalEntryNumber;
    String reversedBy;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryReversedEvent of(JournalEntry original, JournalEntry reversal) {
        return new JournalEntryReversedEvent(
            UUID.randomUUID(),
            original.getId(),
            original.getEntryNumber(),
            reversal.getId(),
            reversal.getEntryNumber(),
            original.getReversedBy(),
            original.getReversalReason(),
            Instant.now()
        );
    }
}
