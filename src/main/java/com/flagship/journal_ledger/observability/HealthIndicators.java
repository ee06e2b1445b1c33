package com.flagship.journal_ledger.observability;

import com.flagship.journal_ledger.outbox.OutboxEventRepository;
import com.flagship.journal_ledger.outbox.OutboxService;
import com.flagship.journal_ledger.posting.JournalPostingQueue;
import com.flagship.journal_ledger.posting.PostingTaskStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the journal ledger service.
 */
public class HealthIndicators {

    /**
     * Outbox backlog. Unhealthy when ledger events pile up unpublished.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository, OutboxService outboxService) {
            this.outboxRepository = outboxRepository;
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(outboxService.getMaxRetries());

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Deferred journal postings. Any dead-lettered task means a business
     * document that never reached the ledger, so it reports WARNING until
     * someone requeues or resolves it.
     */
    @Component("postingQueueHealth")
    public static class PostingQueueHealthIndicator implements HealthIndicator {

        private final JournalPostingQueue postingQueue;

        public PostingQueueHealthIndicator(JournalPostingQueue postingQueue) {
            this.postingQueue = postingQueue;
        }

        @Override
        public Health health() {
            try {
                long pending = postingQueue.countByStatus(PostingTaskStatus.PENDING);
                long deadLettered = postingQueue.countByStatus(PostingTaskStatus.DEAD_LETTER);

                Health.Builder builder = deadLettered == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("pending", pending)
                        .withDetail("deadLettered", deadLettered)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis holds only source-idempotency hints; the database stays authoritative.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Source idempotency falls back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();

                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
