package com.flagship.journal_ledger.posting;

import com.flagship.journal_ledger.journal.SourceType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code journal_posting_tasks}.
 *
 * No setters: status only changes through the transition methods below.
 */
@Entity
@Table(name = "journal_posting_tasks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalPostingTaskEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, updatable = false, length = 20)
    private SourceType sourceType;

    @Column(name = "source_id", updatable = false)
    private Long sourceId;

    @Column(name = "payload", nullable = false, columnDefinition = "jsonb", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PostingTaskStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false)
    private Instant deadline;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "claimed_until")
    private Instant claimedUntil;

    @Column(name = "journal_entry_id")
    private UUID journalEntryId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public static JournalPostingTaskEntity pending(SourceType sourceType, Long sourceId, String payload,
                                                   int maxAttempts, Instant deadline) {
        JournalPostingTaskEntity entity = new JournalPostingTaskEntity();
        entity.id = UUID.randomUUID();
        entity.sourceType = sourceType;
        entity.sourceId = sourceId;
        entity.payload = payload;
        entity.status = PostingTaskStatus.PENDING;
        entity.attempts = 0;
        entity.maxAttempts = maxAttempts;
        entity.deadline = deadline;
        entity.nextAttemptAt = Instant.now();
        return entity;
    }

    public JournalPostingTask toDomain() {
        return new JournalPostingTask(id, sourceType, sourceId, payload, status, attempts, maxAttempts,
            lastError, deadline, nextAttemptAt, journalEntryId, createdAt, completedAt);
    }

    /**
     * Hides the task from other workers until the lease runs out.
     */
    public void claim(Duration lease) {
        this.claimedUntil = Instant.now().plus(lease);
    }

    public void complete(UUID journalEntryId) {
        requirePending();
        this.status = PostingTaskStatus.COMPLETED;
        this.attempts++;
        this.journalEntryId = journalEntryId;
        this.completedAt = Instant.now();
        this.claimedUntil = null;
        this.lastError = null;
    }

    public void scheduleRetry(String error, Instant nextAttemptAt) {
        requirePending();
        this.attempts++;
        this.lastError = error;
        this.nextAttemptAt = nextAttemptAt;
        this.claimedUntil = null;
    }

    public void deadLetter(String error) {
        requirePending();
        this.attempts++;
        this.status = PostingTaskStatus.DEAD_LETTER;
        this.lastError = error;
        this.claimedUntil = null;
    }

    /**
     * Puts a dead-lettered task back in the queue with a fresh attempt budget and deadline.
     */
    public void requeue(Instant newDeadline) {
        if (status != PostingTaskStatus.DEAD_LETTER) {
            throw new IllegalStateException(
                String.format("Cannot requeue posting task %s in %s status", id, status));
        }
        this.status = PostingTaskStatus.PENDING;
        this.attempts = 0;
        this.deadline = newDeadline;
        this.nextAttemptAt = Instant.now();
        this.claimedUntil = null;
    }

    private void requirePending() {
        if (status != PostingTaskStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Posting task %s is %s, not PENDING", id, status));
        }
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
