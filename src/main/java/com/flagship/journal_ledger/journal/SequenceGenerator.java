package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.exception.SequenceContentionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates entry numbers of the form {@code PREFIX-00001}.
 *
 * Each prefix has one counter row in {@code journal_sequences}. Allocation
 * increments that row in the caller's transaction, so the row stays locked
 * until the caller commits or rolls back: concurrent allocations for the same
 * prefix queue behind each other, and a rolled-back allocation gives its
 * number back. Numbers are therefore gap-free and never duplicated.
 *
 * The wait for the row is bounded by a transaction-local {@code lock_timeout}.
 * The timeout stays in effect for the rest of the transaction, which also
 * bounds the account row locks taken later in the posting path.
 */
@Component
@Slf4j
public class SequenceGenerator {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionLocks locks;
    private final LedgerProperties properties;

    public SequenceGenerator(JdbcTemplate jdbcTemplate, TransactionLocks locks, LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.locks = locks;
        this.properties = properties;
    }

    /**
     * Allocates the next number for the prefix configured for the source type.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String nextEntryNumber(SourceType sourceType) {
        return nextEntryNumber(properties.getNumbering().prefixFor(sourceType));
    }

    /**
     * Allocates the next number for a prefix. Must run inside the posting transaction.
     *
     * @throws SequenceContentionException if the counter row could not be locked in time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String nextEntryNumber(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Entry number prefix is required");
        }

        try {
            locks.applyLockTimeout();

            jdbcTemplate.update(
                "INSERT INTO journal_sequences (prefix, last_value) VALUES (?, 0) ON CONFLICT (prefix) DO NOTHING",
                prefix
            );

            Long value = jdbcTemplate.queryForObject(
                "UPDATE journal_sequences SET last_value = last_value + 1, updated_at = CURRENT_TIMESTAMP " +
                "WHERE prefix = ? RETURNING last_value",
                Long.class,
                prefix
            );

            String entryNumber = format(prefix, value);
            log.debug("Allocated entry number {}", entryNumber);
            return entryNumber;

        } catch (PessimisticLockingFailureException e) {
            log.warn("Entry number counter contention: prefix={}, error={}", prefix, e.getMessage());
            throw new SequenceContentionException(prefix, e);
        }
    }

    static String format(String prefix, long value) {
        return String.format("%s-%05d", prefix, value);
    }
}
