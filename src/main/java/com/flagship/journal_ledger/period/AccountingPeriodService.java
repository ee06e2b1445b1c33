package com.flagship.journal_ledger.period;

import com.flagship.journal_ledger.exception.LedgerValidationException;
import com.flagship.journal_ledger.journal.TransactionLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Closes, reopens and locks accounting months, and keeps postings out of
 * months that are not open.
 *
 * A month is only stored once its status is first changed; until then it is
 * open. Status changes take the month's advisory lock exclusively and
 * postings take it shared (see {@link TransactionLocks#acquirePeriodLock}),
 * so a close never overlaps a posting into the same month.
 */
@Service
@Slf4j
public class AccountingPeriodService {

    private static final String SELECT_PERIOD =
        "SELECT id, period_year, period_month, status, notes, closed_by, closed_at, locked_by, locked_at " +
        "FROM accounting_periods";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionLocks locks;

    public AccountingPeriodService(JdbcTemplate jdbcTemplate, TransactionLocks locks) {
        this.jdbcTemplate = jdbcTemplate;
        this.locks = locks;
    }

    /**
     * Rejects a journal write dated in a closed or locked month.
     *
     * Holds the month's shared lock until the caller's transaction ends.
     *
     * @throws LedgerValidationException if the month does not accept postings
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void assertOpenForPosting(LocalDate entryDate) {
        YearMonth month = YearMonth.from(entryDate);
        locks.acquirePeriodLock(month, false);

        Optional<AccountingPeriod> period = find(month);
        if (period.isPresent() && !period.get().getStatus().acceptsPostings()) {
            log.warn("Posting rejected for {} period: entryDate={}", period.get().getStatus(), entryDate);
            throw new LedgerValidationException(String.format(
                "entry date %s falls in accounting period %s, which is %s",
                entryDate, month, period.get().getStatus()));
        }
    }

    /**
     * Closes the month to new postings. Drafts dated in it are left alone but can no longer be posted.
     */
    @Transactional
    public AccountingPeriod close(YearMonth month, String actor, String notes) {
        AccountingPeriod current = lockForChange(month);
        AccountingPeriod closed = current.close(actor, notes, Instant.now());

        Integer drafts = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE status = 'DRAFT' AND entry_date BETWEEN ? AND ?",
            Integer.class, closed.getStartDate(), closed.getEndDate());
        if (drafts != null && drafts > 0) {
            log.warn("Closing period {} with {} draft entries still in it", month, drafts);
        }

        save(closed);
        log.info("Accounting period closed: period={}, by={}", month, actor);
        return closed;
    }

    @Transactional
    public AccountingPeriod reopen(YearMonth month, String actor, String reason) {
        AccountingPeriod reopened = lockForChange(month).reopen(reason);
        save(reopened);
        log.info("Accounting period reopened: period={}, by={}, reason={}", month, actor, reason);
        return reopened;
    }

    /**
     * Makes a closed month permanent.
     */
    @Transactional
    public AccountingPeriod lock(YearMonth month, String actor) {
        AccountingPeriod locked = lockForChange(month).lock(actor, Instant.now());
        save(locked);
        log.info("Accounting period locked: period={}, by={}", month, actor);
        return locked;
    }

    public Optional<AccountingPeriod> find(YearMonth month) {
        return jdbcTemplate.query(SELECT_PERIOD + " WHERE period_year = ? AND period_month = ?",
            periodRowMapper(), month.getYear(), month.getMonthValue()).stream().findFirst();
    }

    public List<AccountingPeriod> findAll() {
        return jdbcTemplate.query(SELECT_PERIOD + " ORDER BY period_year, period_month", periodRowMapper());
    }

    private AccountingPeriod lockForChange(YearMonth month) {
        locks.applyLockTimeout();
        locks.acquirePeriodLock(month, true);

        List<AccountingPeriod> rows = jdbcTemplate.query(
            SELECT_PERIOD + " WHERE period_year = ? AND period_month = ? FOR UPDATE",
            periodRowMapper(), month.getYear(), month.getMonthValue());
        if (!rows.isEmpty()) {
            return rows.get(0);
        }
        AccountingPeriod created = AccountingPeriod.open(month);
        jdbcTemplate.update(
            "INSERT INTO accounting_periods (id, period_year, period_month, status) VALUES (?, ?, ?, ?)",
            created.getId(), month.getYear(), month.getMonthValue(), created.getStatus().name());
        return created;
    }

    private void save(AccountingPeriod period) {
        jdbcTemplate.update(
            "UPDATE accounting_periods SET status = ?, notes = ?, closed_by = ?, closed_at = ?, " +
            "locked_by = ?, locked_at = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            period.getStatus().name(), period.getNotes(), period.getClosedBy(), timestamp(period.getClosedAt()),
            period.getLockedBy(), timestamp(period.getLockedAt()), period.getId());
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static RowMapper<AccountingPeriod> periodRowMapper() {
        return (rs, rowNum) -> {
            Timestamp closedAt = rs.getTimestamp("closed_at");
            Timestamp lockedAt = rs.getTimestamp("locked_at");
            return new AccountingPeriod(
                UUID.fromString(rs.getString("id")),
                YearMonth.of(rs.getInt("period_year"), rs.getInt("period_month")),
                PeriodStatus.valueOf(rs.getString("status")),
                rs.getString("notes"),
                rs.getString("closed_by"),
                closedAt != null ? closedAt.toInstant() : null,
                rs.getString("locked_by"),
                lockedAt != null ? lockedAt.toInstant() : null
            );
        };
    }
}
