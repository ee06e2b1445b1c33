package com.flagship.journal_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox inside the posting transaction.
 *
 * If the journal change commits, its event is guaranteed to exist; if it
 * rolls back, so does the event. Publishing to Kafka is left to
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Saves an event in the caller's transaction. Fails if there is none.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, serializePayload(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    /**
     * Claims a batch of publishable events. Rows stay locked only for this short transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the retry count after this failure
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
