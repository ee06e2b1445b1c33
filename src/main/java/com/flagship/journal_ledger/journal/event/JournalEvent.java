package com.flagship.journal_ledger.journal.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a journal entry, written to the outbox in the transaction that
 * caused it and published to Kafka afterwards.
 *
 * Consumers deduplicate on {@link #getEventId()}.
 */
public interface JournalEvent {

    UUID getEventId();

    /**
     * The journal entry this event is about; also the Kafka partition key.
     */
    UUID getEntryId();

    Instant getOccurredAt();

    String getEventType();
}
