package com.flagship.journal_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in (or already drained from) the outbox.
 *
 * Written in the same transaction as the journal change it describes and
 * published to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "JournalEntry"
    UUID aggregateId;          // journal entry id, used as Kafka key
    String eventType;          // e.g. "JournalEntryPosted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
