package com.flagship.journal_ledger.posting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable queue of journal postings that run after the business transaction.
 *
 * A domain service enqueues in its own transaction, so the queued posting
 * exists if and only if the business change committed. The
 * {@link JournalPostingWorker} then delivers it at least once; the source
 * idempotency check in the posting engine absorbs redeliveries.
 */
@Service
@Slf4j
public class JournalPostingQueue {

    private final JournalPostingTaskRepository repository;
    private final ObjectMapper objectMapper;
    private final LedgerProperties.PostingQueue settings;

    public JournalPostingQueue(JournalPostingTaskRepository repository,
                               ObjectMapper objectMapper,
                               LedgerProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.settings = properties.getPostingQueue();
    }

    /**
     * Queues a posting with the default deadline. Must be called inside the business transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID enqueue(JournalEntryRequest request) {
        return enqueue(request, Instant.now().plus(Duration.ofHours(settings.getDefaultDeadlineHours())));
    }

    /**
     * Queues a posting that must succeed before {@code deadline} or be dead-lettered.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID enqueue(JournalEntryRequest request, Instant deadline) {
        JournalEntryRequest autoPosting = request.isAutoPost() ? request : request.toBuilder().autoPost(true).build();

        JournalPostingTaskEntity task = JournalPostingTaskEntity.pending(
            autoPosting.getSourceType(),
            autoPosting.getSourceId(),
            serialize(autoPosting),
            settings.getMaxAttempts(),
            deadline
        );
        repository.save(task);

        log.info("Queued journal posting: taskId={}, source={}:{}, deadline={}",
                task.getId(), task.getSourceType(), task.getSourceId(), deadline);
        return task.getId();
    }

    /**
     * Leases due tasks to the calling worker. The row locks are released when
     * this short transaction commits; the lease keeps other workers away.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<JournalPostingTask> claimDueTasks(int limit) {
        Duration lease = Duration.ofSeconds(settings.getLeaseSeconds());
        return repository.findDueForUpdate(Instant.now(), limit).stream()
            .map(task -> {
                task.claim(lease);
                return repository.save(task).toDomain();
            })
            .toList();
    }

    /**
     * Marks the task done in the same transaction that created its journal entry.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void markCompleted(UUID taskId, UUID journalEntryId) {
        JournalPostingTaskEntity task = load(taskId);
        task.complete(journalEntryId);
        repository.save(task);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void scheduleRetry(UUID taskId, String error, Instant nextAttemptAt) {
        JournalPostingTaskEntity task = load(taskId);
        task.scheduleRetry(truncate(error), nextAttemptAt);
        repository.save(task);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void deadLetter(UUID taskId, String error) {
        JournalPostingTaskEntity task = load(taskId);
        task.deadLetter(truncate(error));
        repository.save(task);
    }

    @Transactional
    public JournalPostingTask requeue(UUID taskId) {
        JournalPostingTaskEntity task = load(taskId);
        task.requeue(Instant.now().plus(Duration.ofHours(settings.getDefaultDeadlineHours())));
        log.info("Requeued dead-lettered posting task: taskId={}, source={}:{}",
                taskId, task.getSourceType(), task.getSourceId());
        return repository.save(task).toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<JournalPostingTask> findById(UUID taskId) {
        return repository.findById(taskId).map(JournalPostingTaskEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<JournalPostingTask> findDeadLetters() {
        return repository.findByStatusOrderByCreatedAtAsc(PostingTaskStatus.DEAD_LETTER).stream()
            .map(JournalPostingTaskEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countByStatus(PostingTaskStatus status) {
        return repository.countByStatus(status);
    }

    public JournalEntryRequest readRequest(JournalPostingTask task) throws JsonProcessingException {
        return objectMapper.readValue(task.getPayload(), JournalEntryRequest.class);
    }

    private JournalPostingTaskEntity load(UUID taskId) {
        return repository.findById(taskId)
            .orElseThrow(() -> new IllegalArgumentException("Posting task not found: " + taskId));
    }

    private String serialize(JournalEntryRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize journal entry request", e);
        }
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 2000 ? error.substring(0, 2000) : error;
    }
}
