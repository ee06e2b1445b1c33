package com.flagship.journal_ledger.period;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class AccountingPeriodTest {

    private static final YearMonth MARCH = YearMonth.of(2024, 3);

    @Test
    @DisplayName("A month spans its first to last calendar day")
    void monthBounds() {
        AccountingPeriod period = AccountingPeriod.open(YearMonth.of(2024, 2));

        assertEquals(LocalDate.of(2024, 2, 1), period.getStartDate());
        assertEquals(LocalDate.of(2024, 2, 29), period.getEndDate());
        assertTrue(period.getStatus().acceptsPostings());
    }

    @Test
    @DisplayName("Close then reopen returns the month to open and records the reason")
    void closeAndReopen() {
        AccountingPeriod closed = AccountingPeriod.open(MARCH).close("controller", "March close", Instant.now());
        assertEquals(PeriodStatus.CLOSED, closed.getStatus());
        assertEquals("controller", closed.getClosedBy());
        assertFalse(closed.getStatus().acceptsPostings());

        AccountingPeriod reopened = closed.reopen("late supplier invoice");
        assertEquals(PeriodStatus.OPEN, reopened.getStatus());
        assertNull(reopened.getClosedAt());
        assertEquals("Reopened: late supplier invoice", reopened.getNotes());
    }

    @Test
    @DisplayName("Only a closed month can be locked, and a locked month is final")
    void lockIsFinal() {
        AccountingPeriod open = AccountingPeriod.open(MARCH);
        assertThrows(IllegalStateException.class, () -> open.lock("auditor", Instant.now()));

        AccountingPeriod locked = open.close("controller", null, Instant.now()).lock("auditor", Instant.now());
        assertEquals(PeriodStatus.LOCKED, locked.getStatus());
        assertEquals("controller", locked.getClosedBy());

        assertThrows(IllegalStateException.class, () -> locked.reopen("mistake"));
        assertThrows(IllegalStateException.class, () -> locked.close("controller", null, Instant.now()));
        assertThrows(IllegalStateException.class, () -> locked.lock("auditor", Instant.now()));
    }

    @Test
    @DisplayName("Repeating a transition is rejected")
    void repeatedTransitionRejected() {
        AccountingPeriod open = AccountingPeriod.open(MARCH);
        assertThrows(IllegalStateException.class, () -> open.reopen("nothing to reopen"));

        AccountingPeriod closed = open.close("controller", null, Instant.now());
        assertThrows(IllegalStateException.class, () -> closed.close("controller", null, Instant.now()));
    }
}
