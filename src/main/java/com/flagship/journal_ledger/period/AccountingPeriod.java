package com.flagship.journal_ledger.period;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * One calendar month of the books.
 *
 * <pre>
 *   OPEN --close--> CLOSED --lock--> LOCKED
 *   CLOSED --reopen--> OPEN
 * </pre>
 */
@Value
public class AccountingPeriod {
    UUID id;
    YearMonth month;
    PeriodStatus status;
    String notes;
    String closedBy;
    Instant closedAt;
    String lockedBy;
    Instant lockedAt;

    public static AccountingPeriod open(YearMonth month) {
        return new AccountingPeriod(UUID.randomUUID(), month, PeriodStatus.OPEN, null, null, null, null, null);
    }

    public LocalDate getStartDate() {
        return month.atDay(1);
    }

    public LocalDate getEndDate() {
        return month.atEndOfMonth();
    }

    public AccountingPeriod close(String actor, String notes, Instant at) {
        if (status == PeriodStatus.LOCKED) {
            throw new IllegalStateException("Period " + month + " is locked and cannot be closed");
        }
        if (status == PeriodStatus.CLOSED) {
            throw new IllegalStateException("Period " + month + " is already closed");
        }
        return new AccountingPeriod(id, month, PeriodStatus.CLOSED, notes != null ? notes : this.notes,
            actor, at, null, null);
    }

    public AccountingPeriod lock(String actor, Instant at) {
        if (status == PeriodStatus.LOCKED) {
            throw new IllegalStateException("Period " + month + " is already locked");
        }
        if (status != PeriodStatus.CLOSED) {
            throw new IllegalStateException("Period " + month + " must be closed before it can be locked");
        }
        return new AccountingPeriod(id, month, PeriodStatus.LOCKED, notes, closedBy, closedAt, actor, at);
    }

    public AccountingPeriod reopen(String reason) {
        if (status == PeriodStatus.LOCKED) {
            throw new IllegalStateException("Period " + month + " is locked and cannot be reopened");
        }
        if (status == PeriodStatus.OPEN) {
            throw new IllegalStateException("Period " + month + " is already open");
        }
        String reopenNote = reason != null && !reason.isBlank() ? "Reopened: " + reason : notes;
        return new AccountingPeriod(id, month, PeriodStatus.OPEN, reopenNote, null, null, null, null);
    }
}
