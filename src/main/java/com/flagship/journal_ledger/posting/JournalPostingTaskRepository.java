package com.flagship.journal_ledger.posting;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface JournalPostingTaskRepository extends JpaRepository<JournalPostingTaskEntity, UUID> {

    /**
     * Pending tasks that are due and not leased to another worker.
     */
    @Query(value = """
        SELECT * FROM journal_posting_tasks
        WHERE status = 'PENDING'
          AND next_attempt_at <= :now
          AND (claimed_until IS NULL OR claimed_until < :now)
        ORDER BY next_attempt_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<JournalPostingTaskEntity> findDueForUpdate(@Param("now") Instant now, @Param("limit") int limit);

    List<JournalPostingTaskEntity> findByStatusOrderByCreatedAtAsc(PostingTaskStatus status);

    long countByStatus(PostingTaskStatus status);
}
