package com.flagship.journal_ledger.observability;

import com.flagship.journal_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for the ledger event outbox: backlog size, age of the oldest
 * unpublished event, and events that ran out of publish attempts.
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so a scrape
 * never touches the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished ledger events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetteredCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long failed = outboxRepository.countDeadLettered(maxRetries);
            deadLetteredCount.set(failed);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
