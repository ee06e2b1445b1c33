package com.flagship.journal_ledger.posting;

import com.flagship.journal_ledger.journal.SourceType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A journal posting queued for the background worker.
 */
@Value
public class JournalPostingTask {
    UUID id;
    SourceType sourceType;
    Long sourceId;
    String payload;
    PostingTaskStatus status;
    int attempts;
    int maxAttempts;
    String lastError;
    Instant deadline;
    Instant nextAttemptAt;
    UUID journalEntryId;
    Instant createdAt;
    Instant completedAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(deadline);
    }

    public boolean isLastAttempt() {
        return attempts + 1 >= maxAttempts;
    }
}
