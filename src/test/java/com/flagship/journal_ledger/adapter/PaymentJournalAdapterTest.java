package com.flagship.journal_ledger.adapter;

import com.flagship.journal_ledger.account.AccountLookupCache;
import com.flagship.journal_ledger.exception.LedgerValidationException;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalLineRequest;
import com.flagship.journal_ledger.journal.JournalPostingEngine;
import com.flagship.journal_ledger.journal.SourceType;
import com.flagship.journal_ledger.posting.JournalPostingQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentJournalAdapterTest {

    @Mock
    private JournalPostingEngine engine;

    @Mock
    private AccountLookupCache lookup;

    @Mock
    private JournalPostingQueue postingQueue;

    private ChartOfAccountsFixture chart;
    private PaymentJournalAdapter adapter;

    @BeforeEach
    void setUp() {
        chart = new ChartOfAccountsFixture();
        adapter = new PaymentJournalAdapter(engine, lookup, postingQueue);
    }

    private static Payment.PaymentBuilder payment() {
        return Payment.builder()
            .id(42L)
            .number("PAY-0042")
            .date(LocalDate.of(2024, 7, 1))
            .direction(PaymentDirection.CUSTOMER_RECEIPT)
            .method(CashBankMethod.BANK)
            .amount(new BigDecimal("500.00"))
            .counterparty("PT Pelanggan");
    }

    @Test
    @DisplayName("Customer receipt: Dr bank, Cr accounts receivable")
    void customerReceipt() {
        chart.stub(lookup);

        List<JournalLineRequest> lines = adapter.buildJournalLines(payment().build());

        assertEquals(2, lines.size());
        assertEquals(chart.id(ChartOfAccountsCodes.BANK), lines.get(0).getAccountId());
        assertEquals(0, lines.get(0).getDebitAmount().compareTo(new BigDecimal("500.00")));
        assertEquals(chart.id(ChartOfAccountsCodes.ACCOUNTS_RECEIVABLE), lines.get(1).getAccountId());
        assertEquals(0, lines.get(1).getCreditAmount().compareTo(new BigDecimal("500.00")));
    }

    @Test
    @DisplayName("Vendor payment in cash: Dr accounts payable, Cr cash")
    void vendorPayment() {
        chart.stub(lookup);

        List<JournalLineRequest> lines = adapter.buildJournalLines(payment()
            .direction(PaymentDirection.VENDOR_PAYMENT)
            .method(CashBankMethod.CASH)
            .build());

        assertEquals(chart.id(ChartOfAccountsCodes.ACCOUNTS_PAYABLE), lines.get(0).getAccountId());
        assertEquals(0, lines.get(0).getDebitAmount().compareTo(new BigDecimal("500.00")));
        assertEquals(chart.id(ChartOfAccountsCodes.CASH), lines.get(1).getAccountId());
        assertEquals(0, lines.get(1).getCreditAmount().compareTo(new BigDecimal("500.00")));
    }

    @Test
    @DisplayName("Zero amount is rejected before any account is resolved")
    void zeroAmountRejected() {
        assertThrows(LedgerValidationException.class,
            () -> adapter.buildJournalLines(payment().amount(BigDecimal.ZERO).build()));
        verify(lookup, never()).findByCode(any());
    }

    @Test
    @DisplayName("Enqueue writes an auto-posting PAYMENT request to the posting queue")
    void enqueueDefersPosting() {
        chart.stub(lookup);
        UUID taskId = UUID.randomUUID();
        when(postingQueue.enqueue(any(JournalEntryRequest.class))).thenReturn(taskId);

        Optional<UUID> queued = adapter.enqueue(payment().build());

        assertEquals(taskId, queued.orElseThrow());
        ArgumentCaptor<JournalEntryRequest> captor = ArgumentCaptor.forClass(JournalEntryRequest.class);
        verify(postingQueue).enqueue(captor.capture());
        assertEquals(SourceType.PAYMENT, captor.getValue().getSourceType());
        assertEquals(42L, captor.getValue().getSourceId());
        assertTrue(captor.getValue().isAutoPost());
        assertEquals(2, captor.getValue().getLines().size());
        verify(engine, never()).createEntry(any());
    }

    @Test
    @DisplayName("Enqueue skips a payment that already has a live entry")
    void enqueueSkipsJournaledPayment() {
        when(engine.findLiveEntry(SourceType.PAYMENT, 42L)).thenReturn(Optional.of(JournalEntryResult.builder()
            .id(UUID.randomUUID()).entryNumber("CR-00001").build()));

        assertTrue(adapter.enqueue(payment().build()).isEmpty());
        verify(postingQueue, never()).enqueue(any());
        verify(lookup, never()).findByCode(any());
    }
}
