package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.exception.PeriodContentionException;
import com.flagship.journal_ledger.exception.SourceContentionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.YearMonth;

/**
 * Transaction-scoped PostgreSQL locks used by the posting path.
 *
 * Lock order within a posting transaction is fixed: source lock, entry row,
 * accounting period (shared), sequence row, then account rows by ascending id.
 */
@Component
@Slf4j
public class TransactionLocks {

    static final int PERIOD_LOCK_CLASS = 0x4A50;

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    public TransactionLocks(JdbcTemplate jdbcTemplate, LedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    /**
     * Bounds every lock wait for the rest of the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyLockTimeout() {
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            properties.getNumbering().getLockTimeoutMs() + "ms"
        );
    }

    /**
     * Serializes postings of the same source record until the transaction ends.
     * Key collisions between different sources only cost extra waiting.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquireSourceLock(SourceType sourceType, long sourceId) {
        long key = sourceLockKey(sourceType, sourceId);
        try {
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (rs, rowNum) -> Boolean.TRUE, key);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Source lock contention: source={}:{}", sourceType, sourceId);
            throw new SourceContentionException(sourceType + ":" + sourceId, e);
        }
    }

    /**
     * Postings hold the month's lock shared, so closing it waits for them to
     * finish and no posting can start while a close is in progress.
     *
     * @param exclusive true for period status changes, false for postings
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquirePeriodLock(YearMonth month, boolean exclusive) {
        String function = exclusive ? "pg_advisory_xact_lock" : "pg_advisory_xact_lock_shared";
        try {
            jdbcTemplate.query("SELECT " + function + "(?, ?)", (rs, rowNum) -> Boolean.TRUE,
                PERIOD_LOCK_CLASS, periodLockKey(month));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Accounting period lock contention: period={}, exclusive={}", month, exclusive);
            throw new PeriodContentionException(month.toString(), e);
        }
    }

    static int periodLockKey(YearMonth month) {
        return month.getYear() * 100 + month.getMonthValue();
    }

    static long sourceLockKey(SourceType sourceType, long sourceId) {
        return ((long) (sourceType.ordinal() + 1) << 56) ^ sourceId;
    }
}
