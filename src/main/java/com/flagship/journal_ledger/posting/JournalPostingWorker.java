package com.flagship.journal_ledger.posting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.exception.LedgerException;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalPostingEngine;
import com.flagship.journal_ledger.observability.CorrelationContext;
import com.flagship.journal_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background delivery of queued journal postings.
 *
 * Each attempt runs in its own transaction with a bounded timeout. The
 * journal entry and the task's COMPLETED mark commit together, so a crash
 * mid-attempt leaves the task pending and the entry unwritten.
 *
 * Failure handling:
 * - Validation, state and chart-of-accounts errors will fail again: dead-letter at once
 * - Anything else (lock contention, timeouts, database hiccups) is retried
 *   with exponential backoff
 * - A task past its deadline or out of attempts is dead-lettered
 */
@Component
@Slf4j
public class JournalPostingWorker {

    private final JournalPostingQueue queue;
    private final JournalPostingEngine engine;
    private final LedgerMetrics metrics;
    private final LedgerProperties.PostingQueue settings;
    private final TransactionTemplate attemptTemplate;

    public JournalPostingWorker(JournalPostingQueue queue,
                                JournalPostingEngine engine,
                                LedgerMetrics metrics,
                                LedgerProperties properties,
                                PlatformTransactionManager transactionManager) {
        this.queue = queue;
        this.engine = engine;
        this.metrics = metrics;
        this.settings = properties.getPostingQueue();
        this.attemptTemplate = new TransactionTemplate(transactionManager);
        this.attemptTemplate.setTimeout(settings.getAttemptTimeoutSeconds());
    }

    @Scheduled(fixedDelayString = "${ledger.posting-queue.poll-interval-ms:2000}")
    public void pollDueTasks() {
        if (!settings.isEnabled()) {
            return;
        }
        try {
            processDueTasks();
        } catch (Exception e) {
            log.error("Error in posting worker polling loop", e);
        }
    }

    /**
     * Claims one batch of due tasks and attempts each.
     *
     * @return number of tasks attempted
     */
    public int processDueTasks() {
        List<JournalPostingTask> tasks = queue.claimDueTasks(settings.getBatchSize());
        if (!tasks.isEmpty()) {
            log.debug("Claimed {} posting tasks", tasks.size());
        }
        for (JournalPostingTask task : tasks) {
            attempt(task);
        }
        return tasks.size();
    }

    void attempt(JournalPostingTask task) {
        try (CorrelationContext.Scope ignored = CorrelationContext.openForPostingTask(task.getId())) {
            CorrelationContext.putSource(task.getSourceType(), task.getSourceId());
            if (task.isExpired(Instant.now())) {
                deadLetter(task, "deadline exceeded at " + task.getDeadline());
                return;
            }

            JournalEntryRequest request = queue.readRequest(task);
            JournalEntryResult result = attemptTemplate.execute(status -> {
                JournalEntryResult posted = engine.createEntry(request);
                queue.markCompleted(task.getId(), posted.getId());
                return posted;
            });

            metrics.recordPostingTask(result != null && result.isReplayed() ? "replayed" : "completed");
            log.info("Posting task completed: taskId={}, source={}:{}, entryNumber={}, attempt={}",
                    task.getId(), task.getSourceType(), task.getSourceId(),
                    result != null ? result.getEntryNumber() : null, task.getAttempts() + 1);

        } catch (JsonProcessingException e) {
            deadLetter(task, "unreadable payload: " + e.getOriginalMessage());
        } catch (LedgerException e) {
            if (e.isRetryable()) {
                retryOrDeadLetter(task, e.getErrorCode() + ": " + e.getMessage());
            } else {
                deadLetter(task, e.getErrorCode() + ": " + e.getMessage());
            }
        } catch (RuntimeException e) {
            retryOrDeadLetter(task, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void retryOrDeadLetter(JournalPostingTask task, String error) {
        if (task.isLastAttempt()) {
            deadLetter(task, "attempts exhausted (" + task.getMaxAttempts() + "): " + error);
            return;
        }
        Instant next = Instant.now().plus(backoff(task.getAttempts(), settings.getBaseBackoffMs(), settings.getMaxBackoffMs()));
        if (next.isAfter(task.getDeadline())) {
            deadLetter(task, "next retry would pass deadline: " + error);
            return;
        }
        queue.scheduleRetry(task.getId(), error, next);
        metrics.recordPostingTask("retry_scheduled");
        log.warn("Posting task failed, retry scheduled: taskId={}, attempt={}, nextAttemptAt={}, error={}",
                task.getId(), task.getAttempts() + 1, next, error);
    }

    private void deadLetter(JournalPostingTask task, String error) {
        queue.deadLetter(task.getId(), error);
        metrics.recordPostingTask("dead_lettered");
        log.error("Posting task dead-lettered: taskId={}, source={}:{}, attempts={}, error={}",
                task.getId(), task.getSourceType(), task.getSourceId(), task.getAttempts() + 1, error);
    }

    /**
     * Exponential backoff: base * 2^attempts, capped.
     */
    static Duration backoff(int attemptsSoFar, long baseMs, long maxMs) {
        int exponent = Math.min(attemptsSoFar, 30);
        long delay = baseMs * (1L << exponent);
        if (delay <= 0 || delay > maxMs) {
            delay = maxMs;
        }
        return Duration.ofMillis(delay);
    }
}
