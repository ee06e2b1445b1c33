package com.flagship.journal_ledger.outbox;

import com.flagship.journal_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox to the {@code journal-entries} Kafka topic.
 *
 * Events are sent one at a time and acknowledged before being marked, keyed
 * by journal entry id so all events of one entry land on one partition in
 * order. A failed send increments the event's retry count; once it reaches
 * {@code outbox.publisher.max-retries} the event is no longer picked up and
 * counts as dead-lettered until someone intervenes.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.journal-entries:journal-entries}")
    private String journalEntriesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(journalEntriesTopic, event.getAggregateId().toString(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            int retries = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (retries >= outboxService.getMaxRetries()) {
                log.warn("Event {} exhausted {} retries, moved to dead letter. eventType={}, aggregateId={}",
                        event.getId(), retries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
