package com.flagship.journal_ledger.adapter;

import com.flagship.journal_ledger.account.AccountLookupCache;
import com.flagship.journal_ledger.exception.ChartOfAccountsIntegrityException;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalLineRequest;
import com.flagship.journal_ledger.journal.JournalPostingEngine;
import com.flagship.journal_ledger.journal.JournalStatus;
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

import static com.flagship.journal_ledger.adapter.ChartOfAccountsFixture.credits;
import static com.flagship.journal_ledger.adapter.ChartOfAccountsFixture.debits;
import static com.flagship.journal_ledger.adapter.ChartOfAccountsFixture.lineFor;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SalesJournalAdapterTest {

    @Mock
    private JournalPostingEngine engine;

    @Mock
    private AccountLookupCache lookup;

    @Mock
    private JournalPostingQueue postingQueue;

    private ChartOfAccountsFixture chart;
    private SalesJournalAdapter adapter;

    @BeforeEach
    void setUp() {
        chart = new ChartOfAccountsFixture();
        adapter = new SalesJournalAdapter(engine, lookup, postingQueue);
    }

    private static Sale.SaleBuilder sale() {
        return Sale.builder()
            .id(7L)
            .invoiceNumber("INV-0007")
            .date(LocalDate.of(2024, 5, 2))
            .status(SaleStatus.INVOICED)
            .settlementMethod(SettlementMethod.CREDIT)
            .customerName("Toko Maju")
            .subtotal(new BigDecimal("1000.00"))
            .taxAmount(new BigDecimal("110.00"))
            .costOfGoodsSold(new BigDecimal("600.00"))
            .createdBy("sales-bot");
    }

    @Test
    @DisplayName("Credit sale: AR for the gross, revenue and VAT output, plus COGS against inventory")
    void creditSaleLines() {
        chart.stub(lookup);

        List<JournalLineRequest> lines = adapter.buildJournalLines(sale().build());

        assertEquals(5, lines.size());
        assertEquals(0, debits(lines).compareTo(credits(lines)));
        assertEquals(0, lineFor(lines, chart.id(ChartOfAccountsCodes.ACCOUNTS_RECEIVABLE)).orElseThrow()
            .getDebitAmount().compareTo(new BigDecimal("1110.00")));
        assertEquals(0, lineFor(lines, chart.id(ChartOfAccountsCodes.SALES_REVENUE)).orElseThrow()
            .getCreditAmount().compareTo(new BigDecimal("1000.00")));
        assertEquals(0, lineFor(lines, chart.id(ChartOfAccountsCodes.VAT_OUTPUT)).orElseThrow()
            .getCreditAmount().compareTo(new BigDecimal("110.00")));
        assertEquals(0, lineFor(lines, chart.id(ChartOfAccountsCodes.COST_OF_GOODS_SOLD)).orElseThrow()
            .getDebitAmount().compareTo(new BigDecimal("600.00")));
        assertEquals(0, lineFor(lines, chart.id(ChartOfAccountsCodes.INVENTORY)).orElseThrow()
            .getCreditAmount().compareTo(new BigDecimal("600.00")));
    }

    @Test
    @DisplayName("Cash sale without tax or cost posts two lines to the chosen cash account")
    void cashSaleWithOverride() {
        chart.stub(lookup);

        List<JournalLineRequest> lines = adapter.buildJournalLines(sale()
            .settlementMethod(SettlementMethod.CASH)
            .cashBankAccountCode("1103")
            .taxAmount(null)
            .costOfGoodsSold(BigDecimal.ZERO)
            .build());

        assertEquals(2, lines.size());
        assertTrue(lineFor(lines, chart.id("1103")).isPresent());
        assertTrue(lineFor(lines, chart.id(ChartOfAccountsCodes.CASH)).isEmpty());
    }

    @Test
    @DisplayName("Bank sale without override uses the default bank account")
    void bankSaleDefaultAccount() {
        chart.stub(lookup);

        List<JournalLineRequest> lines = adapter.buildJournalLines(sale()
            .settlementMethod(SettlementMethod.BANK)
            .build());

        assertEquals(0, lineFor(lines, chart.id(ChartOfAccountsCodes.BANK)).orElseThrow()
            .getDebitAmount().compareTo(new BigDecimal("1110.00")));
    }

    @Test
    @DisplayName("Draft and cancelled sales are skipped without touching the engine")
    void nonFinalSalesSkipped() {
        assertTrue(adapter.post(sale().status(SaleStatus.DRAFT).build()).isEmpty());
        assertTrue(adapter.post(sale().status(SaleStatus.CANCELLED).build()).isEmpty());

        verify(engine, never()).createEntry(any());
    }

    @Test
    @DisplayName("Invoiced sale is posted as an auto-posted SALES entry keyed by the sale id")
    void invoicedSalePosted() {
        chart.stub(lookup);
        JournalEntryResult result = JournalEntryResult.builder()
            .id(UUID.randomUUID()).entryNumber("SJ-00001").status(JournalStatus.POSTED).build();
        when(engine.createEntry(any())).thenReturn(result);

        Optional<JournalEntryResult> posted = adapter.post(sale().status(SaleStatus.PAID).build());

        assertEquals("SJ-00001", posted.orElseThrow().getEntryNumber());
        ArgumentCaptor<JournalEntryRequest> captor = ArgumentCaptor.forClass(JournalEntryRequest.class);
        verify(engine).createEntry(captor.capture());
        JournalEntryRequest request = captor.getValue();
        assertEquals(SourceType.SALES, request.getSourceType());
        assertEquals(7L, request.getSourceId());
        assertTrue(request.isAutoPost());
        assertEquals("INV-0007", request.getReference());
        assertEquals(LocalDate.of(2024, 5, 2), request.getEntryDate());
    }

    @Test
    @DisplayName("An already journaled sale returns its entry without resolving any account")
    void journaledSaleReplayedBeforeAccountLookup() {
        JournalEntryResult existing = JournalEntryResult.builder()
            .id(UUID.randomUUID()).entryNumber("SJ-00001").status(JournalStatus.POSTED).replayed(true).build();
        when(engine.findLiveEntry(SourceType.SALES, 7L)).thenReturn(Optional.of(existing));

        Optional<JournalEntryResult> posted = adapter.post(sale().status(SaleStatus.PAID).build());

        assertSame(existing, posted.orElseThrow());
        verify(lookup, never()).findByCode(any());
        verify(engine, never()).createEntry(any());
    }

    @Test
    @DisplayName("Missing VAT output account fails closed")
    void missingAccountFails() {
        chart.remove(ChartOfAccountsCodes.VAT_OUTPUT);
        chart.stub(lookup);

        ChartOfAccountsIntegrityException e = assertThrows(ChartOfAccountsIntegrityException.class,
            () -> adapter.buildJournalLines(sale().build()));
        assertEquals(ChartOfAccountsCodes.VAT_OUTPUT, e.getAccountCode());
    }

    @Test
    @DisplayName("Override pointing at a header account fails closed")
    void headerOverrideFails() {
        chart.stub(lookup);

        assertThrows(ChartOfAccountsIntegrityException.class, () -> adapter.buildJournalLines(sale()
            .settlementMethod(SettlementMethod.CASH)
            .cashBankAccountCode("1100")
            .build()));
    }
}
