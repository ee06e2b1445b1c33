package com.flagship.journal_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for journal operations.
 *
 * Metrics exposed:
 * - ledger.entries.created: entries written, tagged by source type and resulting status
 * - ledger.entries.posted / ledger.entries.reversed
 * - ledger.validation.failures: rejected requests by source type
 * - ledger.contention: lock timeouts by kind (sequence, balance)
 * - ledger.idempotency: source duplicate checks, hit or miss
 * - ledger.operation.latency: timer per engine operation
 * - ledger.posting_tasks: deferred posting outcomes
 * - ledger.balance.drift: accounts found out of step with the journal
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter entriesReversed;
    private final Counter idempotencyHits;
    private final Counter idempotencyMisses;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesReversed = Counter.builder("ledger.entries.reversed")
                .description("Number of journal entries reversed")
                .register(registry);

        this.idempotencyHits = Counter.builder("ledger.idempotency")
                .description("Source idempotency checks")
                .tag("result", "hit")
                .register(registry);

        this.idempotencyMisses = Counter.builder("ledger.idempotency")
                .description("Source idempotency checks")
                .tag("result", "miss")
                .register(registry);
    }

    public void recordEntryCreated(String sourceType, String status) {
        registry.counter("ledger.entries.created",
                "source_type", sanitizeTag(sourceType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordEntryPosted(String sourceType) {
        registry.counter("ledger.entries.posted", "source_type", sanitizeTag(sourceType)).increment();
    }

    public void recordEntryReversed() {
        entriesReversed.increment();
    }

    public void recordValidationFailure(String sourceType) {
        registry.counter("ledger.validation.failures", "source_type", sanitizeTag(sourceType)).increment();
    }

    public void recordContention(String kind) {
        registry.counter("ledger.contention", "kind", sanitizeTag(kind)).increment();
    }

    public void recordIdempotencyHit() {
        idempotencyHits.increment();
    }

    public void recordIdempotencyMiss() {
        idempotencyMisses.increment();
    }

    /**
     * Records engine operation latency.
     */
    public void recordLatency(String operation, String outcome, long durationMs) {
        Timer.builder("ledger.operation.latency")
                .description("Latency of journal engine operations")
                .tag("operation", sanitizeTag(operation))
                .tag("outcome", sanitizeTag(outcome))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordPostingTask(String outcome) {
        registry.counter("ledger.posting_tasks", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordBalanceDrift(boolean healed) {
        registry.counter("ledger.balance.drift", "healed", String.valueOf(healed)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
