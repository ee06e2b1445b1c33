package com.flagship.journal_ledger.adapter;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountCatalog;
import com.flagship.journal_ledger.account.AccountType;
import com.flagship.journal_ledger.account.AccountUpdate;
import com.flagship.journal_ledger.exception.ChartOfAccountsIntegrityException;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalStatus;
import com.flagship.journal_ledger.posting.JournalPostingQueue;
import com.flagship.journal_ledger.posting.JournalPostingTask;
import com.flagship.journal_ledger.posting.JournalPostingWorker;
import com.flagship.journal_ledger.posting.PostingTaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Adapters posting against the seeded chart of accounts. Seeded balances are
 * shared by every test in the class, so assertions compare before and after.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SourceAdaptersIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_journal")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private SalesJournalAdapter salesAdapter;

    @Autowired
    private PurchaseJournalAdapter purchaseAdapter;

    @Autowired
    private PaymentJournalAdapter paymentAdapter;

    @Autowired
    private AccountCatalog accountCatalog;

    @Autowired
    private JournalPostingQueue postingQueue;

    @Autowired
    private JournalPostingWorker postingWorker;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private static long newSourceId() {
        return ThreadLocalRandom.current().nextLong(1_000_000, Long.MAX_VALUE);
    }

    private BigDecimal balance(String code) {
        return accountCatalog.findByCode(code).orElseThrow().getCurrentBalance();
    }

    private static void assertMoved(String code, BigDecimal before, BigDecimal after, String expectedDelta) {
        assertEquals(0, new BigDecimal(expectedDelta).compareTo(after.subtract(before)),
            "account " + code + " moved " + after.subtract(before));
    }

    private Sale.SaleBuilder invoicedSale() {
        long id = newSourceId();
        return Sale.builder()
            .id(id)
            .invoiceNumber("INV-" + id)
            .date(LocalDate.now())
            .status(SaleStatus.INVOICED)
            .settlementMethod(SettlementMethod.CREDIT)
            .customerName("Acme")
            .subtotal(new BigDecimal("1000.00"))
            .taxAmount(new BigDecimal("110.00"))
            .costOfGoodsSold(new BigDecimal("600.00"))
            .createdBy("sales");
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Credit sale posts receivable, revenue, VAT and cost of goods sold")
    void creditSale() {
        BigDecimal ar = balance("1201");
        BigDecimal revenue = balance("4101");
        BigDecimal vat = balance("2103");
        BigDecimal cogs = balance("5101");
        BigDecimal inventory = balance("1301");

        JournalEntryResult result = salesAdapter.post(invoicedSale().build()).orElseThrow();
        printOutput("Entry", result.getEntryNumber());

        assertEquals(JournalStatus.POSTED, result.getStatus());
        assertTrue(result.getEntryNumber().startsWith("SJ-"));
        assertEquals(0, new BigDecimal("1710.00").compareTo(result.getTotalDebit()));
        assertMoved("1201", ar, balance("1201"), "1110.00");
        assertMoved("4101", revenue, balance("4101"), "1000.00");
        assertMoved("2103", vat, balance("2103"), "110.00");
        assertMoved("5101", cogs, balance("5101"), "600.00");
        assertMoved("1301", inventory, balance("1301"), "-600.00");
    }

    @Test
    @DisplayName("Posting the same sale twice returns the first entry")
    void saleReplay() {
        Sale sale = invoicedSale().settlementMethod(SettlementMethod.CASH).build();
        BigDecimal cash = balance("1101");

        JournalEntryResult first = salesAdapter.post(sale).orElseThrow();
        JournalEntryResult second = salesAdapter.post(sale).orElseThrow();

        assertTrue(second.isReplayed());
        assertEquals(first.getId(), second.getId());
        assertMoved("1101", cash, balance("1101"), "1110.00");
    }

    @Test
    @DisplayName("Replaying a sale still succeeds after its settlement account is deactivated")
    void saleReplayAfterAccountDeactivated() {
        Account till = accountCatalog.createAccount("T" + UUID.randomUUID().toString().substring(0, 8),
            "Store till", AccountType.ASSET, null);
        Sale sale = invoicedSale().settlementMethod(SettlementMethod.CASH).cashBankAccountCode(till.getCode()).build();

        JournalEntryResult first = salesAdapter.post(sale).orElseThrow();
        accountCatalog.update(till.getId(), AccountUpdate.builder().active(false).build());
        JournalEntryResult second = salesAdapter.post(sale).orElseThrow();

        assertTrue(second.isReplayed());
        assertEquals(first.getId(), second.getId());
    }

    @Test
    @DisplayName("Draft sale is skipped")
    void draftSaleSkipped() {
        assertEquals(Optional.empty(), salesAdapter.post(invoicedSale().status(SaleStatus.DRAFT).build()));
    }

    @Test
    @DisplayName("Header account as settlement override fails closed")
    void headerOverrideRejected() {
        BigDecimal revenue = balance("4101");
        Sale sale = invoicedSale().settlementMethod(SettlementMethod.CASH).cashBankAccountCode("1100").build();

        assertThrows(ChartOfAccountsIntegrityException.class, () -> salesAdapter.post(sale));
        assertMoved("4101", revenue, balance("4101"), "0");
    }

    @Test
    @DisplayName("Transfer purchase debits items and input VAT, credits bank net of withholding")
    void transferPurchase() {
        BigDecimal inventory = balance("1301");
        BigDecimal expenses = balance("6101");
        BigDecimal vatIn = balance("1240");
        BigDecimal bank = balance("1102");
        BigDecimal pph23 = balance("2112");
        long id = newSourceId();

        JournalEntryResult result = purchaseAdapter.post(Purchase.builder()
            .id(id)
            .code("PO-" + id)
            .date(LocalDate.now())
            .vendorName("Supplier")
            .method(PurchasePaymentMethod.TRANSFER)
            .item(PurchaseItem.builder().description("Stock").amount(new BigDecimal("500.00")).build())
            .item(PurchaseItem.builder().description("Cleaning").amount(new BigDecimal("200.00"))
                .expenseAccountCode("6101").build())
            .inputTax(new BigDecimal("77.00"))
            .pph23(new BigDecimal("14.00"))
            .createdBy("purchasing")
            .build()).orElseThrow();

        assertTrue(result.getEntryNumber().startsWith("PJ-"));
        assertMoved("1301", inventory, balance("1301"), "500.00");
        assertMoved("6101", expenses, balance("6101"), "200.00");
        assertMoved("1240", vatIn, balance("1240"), "77.00");
        assertMoved("1102", bank, balance("1102"), "-763.00");
        assertMoved("2112", pph23, balance("2112"), "14.00");
    }

    @Test
    @DisplayName("Customer receipt moves cash in and clears receivable")
    void customerReceipt() {
        BigDecimal cash = balance("1101");
        BigDecimal ar = balance("1201");
        long id = newSourceId();
        Payment payment = Payment.builder()
            .id(id)
            .number("RCV-" + id)
            .date(LocalDate.now())
            .direction(PaymentDirection.CUSTOMER_RECEIPT)
            .method(CashBankMethod.CASH)
            .amount(new BigDecimal("300.00"))
            .counterparty("Acme")
            .build();

        JournalEntryResult first = paymentAdapter.post(payment).orElseThrow();
        JournalEntryResult replay = paymentAdapter.post(payment).orElseThrow();

        assertTrue(first.getEntryNumber().startsWith("PY-"));
        assertTrue(replay.isReplayed());
        assertMoved("1101", cash, balance("1101"), "300.00");
        assertMoved("1201", ar, balance("1201"), "-300.00");
    }

    @Test
    @DisplayName("Deferred posting needs the caller's transaction")
    void enqueueRequiresTransaction() {
        Sale sale = invoicedSale().build();
        assertThrows(IllegalTransactionStateException.class, () -> salesAdapter.enqueue(sale));
    }

    @Test
    @DisplayName("Deferred posting is delivered by the worker")
    void enqueueThenDeliver() {
        long id = newSourceId();
        Payment payment = Payment.builder()
            .id(id)
            .number("PAY-" + id)
            .date(LocalDate.now())
            .direction(PaymentDirection.VENDOR_PAYMENT)
            .method(CashBankMethod.BANK)
            .amount(new BigDecimal("125.00"))
            .counterparty("Supplier")
            .build();
        BigDecimal payable = balance("2101");

        UUID taskId = transactionTemplate.execute(status -> paymentAdapter.enqueue(payment).orElseThrow());
        assertNotNull(taskId);
        assertMoved("2101", payable, balance("2101"), "0");

        postingWorker.processDueTasks();

        JournalPostingTask task = postingQueue.findById(taskId).orElseThrow();
        assertEquals(PostingTaskStatus.COMPLETED, task.getStatus());
        assertNotNull(task.getJournalEntryId());
        assertMoved("2101", payable, balance("2101"), "-125.00");
    }
}
