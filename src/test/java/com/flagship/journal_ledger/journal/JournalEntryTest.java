package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.exception.LedgerStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryTest {

    private static JournalEntry entry(JournalStatus status) {
        return new JournalEntry(UUID.randomUUID(), "JE-00001", SourceType.MANUAL, null, null,
            LocalDate.of(2024, 1, 31), "Accrual", status, new BigDecimal("50.00"), new BigDecimal("50.00"),
            "alice", Instant.now(), status == JournalStatus.DRAFT ? null : Instant.now(),
            null, null, null, null, null, List.of());
    }

    @Test
    @DisplayName("Draft can be posted")
    void draftPosts() {
        Instant at = Instant.parse("2024-02-01T10:00:00Z");

        JournalEntry posted = entry(JournalStatus.DRAFT).post(at);

        assertEquals(JournalStatus.POSTED, posted.getStatus());
        assertEquals(at, posted.getPostedAt());
    }

    @Test
    @DisplayName("Posting twice fails with ALREADY_POSTED")
    void postingTwiceFails() {
        JournalEntry posted = entry(JournalStatus.POSTED);

        LedgerStateException e = assertThrows(LedgerStateException.class, () -> posted.post(Instant.now()));
        assertEquals(LedgerStateException.Reason.ALREADY_POSTED, e.getReason());
        assertEquals(JournalStatus.POSTED, e.getCurrentStatus());
    }

    @Test
    @DisplayName("Reversed entry cannot be posted or reversed again")
    void reversedIsTerminal() {
        JournalEntry reversed = entry(JournalStatus.REVERSED);

        assertEquals(LedgerStateException.Reason.ALREADY_REVERSED,
            assertThrows(LedgerStateException.class, () -> reversed.post(Instant.now())).getReason());
        assertEquals(LedgerStateException.Reason.ALREADY_REVERSED,
            assertThrows(LedgerStateException.class,
                () -> reversed.markReversed(UUID.randomUUID(), "bob", "again", Instant.now())).getReason());
    }

    @Test
    @DisplayName("Draft cannot be reversed")
    void draftCannotBeReversed() {
        LedgerStateException e = assertThrows(LedgerStateException.class,
            () -> entry(JournalStatus.DRAFT).markReversed(UUID.randomUUID(), "bob", "oops", Instant.now()));

        assertEquals(LedgerStateException.Reason.NOT_POSTED, e.getReason());
        assertEquals("NOT_POSTED", e.getErrorCode());
    }

    @Test
    @DisplayName("Reversal records who, why, when and the reversing entry")
    void markReversedRecordsAudit() {
        UUID reversalId = UUID.randomUUID();
        Instant at = Instant.now();

        JournalEntry reversed = entry(JournalStatus.POSTED).markReversed(reversalId, "bob", "duplicate", at);

        assertEquals(JournalStatus.REVERSED, reversed.getStatus());
        assertEquals(reversalId, reversed.getReversedById());
        assertEquals("bob", reversed.getReversedBy());
        assertEquals("duplicate", reversed.getReversalReason());
        assertEquals(at, reversed.getReversedAt());
        assertNotNull(reversed.getPostedAt());
    }

    @Test
    @DisplayName("Balance check honours the tolerance")
    void balanceTolerance() {
        JournalEntry off = new JournalEntry(UUID.randomUUID(), "JE-00002", SourceType.MANUAL, null, null,
            LocalDate.now(), "x", JournalStatus.DRAFT, new BigDecimal("10.004"), new BigDecimal("10.00"),
            null, Instant.now(), null, null, null, null, null, null, List.of());

        assertTrue(off.isBalanced(new BigDecimal("0.005")));
        assertFalse(off.isBalanced(new BigDecimal("0.001")));
    }
}
