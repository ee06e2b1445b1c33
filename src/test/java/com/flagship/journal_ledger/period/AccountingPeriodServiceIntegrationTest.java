package com.flagship.journal_ledger.period;

import com.flagship.journal_ledger.account.AccountCatalog;
import com.flagship.journal_ledger.account.AccountType;
import com.flagship.journal_ledger.exception.LedgerValidationException;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalLineRequest;
import com.flagship.journal_ledger.journal.JournalPostingEngine;
import com.flagship.journal_ledger.journal.JournalStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Month-end controls against a real PostgreSQL. Each test works in its own month.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AccountingPeriodServiceIntegrationTest {

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
    private AccountingPeriodService periodService;

    @Autowired
    private JournalPostingEngine engine;

    @Autowired
    private AccountCatalog accountCatalog;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID cashId;
    private UUID revenueId;

    @BeforeEach
    void setUp() {
        cashId = accountCatalog.createAccount("T" + UUID.randomUUID().toString().substring(0, 8),
            "Cash", AccountType.ASSET, null).getId();
        revenueId = accountCatalog.createAccount("T" + UUID.randomUUID().toString().substring(0, 8),
            "Revenue", AccountType.REVENUE, null).getId();
    }

    private JournalEntryRequest sale(LocalDate date, boolean autoPost) {
        BigDecimal amount = new BigDecimal("75.00");
        return JournalEntryRequest.builder()
            .entryDate(date)
            .description("Cash sale")
            .lines(List.of(
                JournalLineRequest.debit(cashId, amount, null),
                JournalLineRequest.credit(revenueId, amount, null)))
            .autoPost(autoPost)
            .build();
    }

    private BigDecimal cashBalance() {
        return accountCatalog.findById(cashId).orElseThrow().getCurrentBalance();
    }

    @Test
    @DisplayName("A month never closed accepts postings and has no stored row")
    void unseenMonthIsOpen() {
        YearMonth month = YearMonth.of(2001, 1);

        JournalEntryResult posted = engine.createEntry(sale(month.atDay(15), true));

        assertEquals(JournalStatus.POSTED, posted.getStatus());
        assertTrue(periodService.find(month).isEmpty());
    }

    @Test
    @DisplayName("A closed month rejects postings until it is reopened")
    void closedMonthRejectsPostings() {
        YearMonth month = YearMonth.of(2001, 2);
        AccountingPeriod closed = periodService.close(month, "controller", "February close");
        assertEquals(PeriodStatus.CLOSED, closed.getStatus());

        BigDecimal before = cashBalance();
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> engine.createEntry(sale(month.atDay(10), true)));
        assertTrue(e.getViolations().get(0).contains("2001-02"));
        assertEquals(0, before.compareTo(cashBalance()));

        periodService.reopen(month, "controller", "late invoice");
        JournalEntryResult posted = engine.createEntry(sale(month.atDay(10), true));

        assertEquals(JournalStatus.POSTED, posted.getStatus());
        assertEquals(PeriodStatus.OPEN, periodService.find(month).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("A draft created before the close cannot be posted after it")
    void draftBlockedByClose() {
        YearMonth month = YearMonth.of(2001, 3);
        JournalEntryResult draft = engine.createEntry(sale(month.atDay(31), false));
        assertEquals(JournalStatus.DRAFT, draft.getStatus());

        periodService.close(month, "controller", null);

        assertThrows(LedgerValidationException.class, () -> engine.postEntry(draft.getId()));
        assertEquals(JournalStatus.DRAFT, engine.getEntry(draft.getId()).getStatus());
    }

    @Test
    @DisplayName("A reversal cannot be dated into a closed month")
    void reversalIntoClosedMonthRejected() {
        JournalEntryResult posted = engine.createEntry(sale(LocalDate.of(2001, 4, 20), true));
        periodService.close(YearMonth.of(2001, 5), "controller", null);

        assertThrows(LedgerValidationException.class, () ->
            engine.reverseEntry(posted.getId(), "duplicate", "auditor", LocalDate.of(2001, 5, 3)));

        assertEquals(JournalStatus.POSTED, engine.getEntry(posted.getId()).getStatus());
    }

    @Test
    @DisplayName("A locked month cannot be reopened, and the database refuses to change it")
    void lockedMonthIsFinal() {
        YearMonth month = YearMonth.of(2001, 6);
        periodService.close(month, "controller", null);
        AccountingPeriod locked = periodService.lock(month, "auditor");
        assertEquals(PeriodStatus.LOCKED, locked.getStatus());

        assertThrows(IllegalStateException.class, () -> periodService.reopen(month, "controller", "mistake"));
        assertThrows(LedgerValidationException.class, () -> engine.createEntry(sale(month.atDay(1), true)));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE accounting_periods SET status = 'OPEN' WHERE id = ?", locked.getId()));
    }

    @Test
    @DisplayName("An open month cannot be locked")
    void lockRequiresClose() {
        YearMonth month = YearMonth.of(2001, 7);

        assertThrows(IllegalStateException.class, () -> periodService.lock(month, "auditor"));
        assertTrue(periodService.find(month).isEmpty());
    }
}
