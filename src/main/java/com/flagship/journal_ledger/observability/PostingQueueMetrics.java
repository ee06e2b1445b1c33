package com.flagship.journal_ledger.observability;

import com.flagship.journal_ledger.posting.JournalPostingQueue;
import com.flagship.journal_ledger.posting.PostingTaskStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cached gauges for the deferred posting queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostingQueueMetrics {

    private final JournalPostingQueue postingQueue;
    private final MeterRegistry meterRegistry;

    private final AtomicLong pending = new AtomicLong(0);
    private final AtomicLong deadLettered = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.posting.queue.size", pending, AtomicLong::get)
                .description("Queued journal postings waiting for the worker")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("ledger.posting.queue.size", deadLettered, AtomicLong::get)
                .description("Queued journal postings that were dead-lettered")
                .tag("status", "dead_letter")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            pending.set(postingQueue.countByStatus(PostingTaskStatus.PENDING));
            deadLettered.set(postingQueue.countByStatus(PostingTaskStatus.DEAD_LETTER));
        } catch (Exception e) {
            log.warn("Failed to refresh posting queue metrics: {}", e.getMessage());
        }
    }

}
