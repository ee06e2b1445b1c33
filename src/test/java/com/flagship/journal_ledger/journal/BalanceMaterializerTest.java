package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountType;
import com.flagship.journal_ledger.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BalanceMaterializerTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private static Account account(AccountType type) {
        return new Account(UUID.randomUUID(), "T" + type.ordinal(), type.name(), type, null, false, true,
            BigDecimal.ZERO, null);
    }

    private static JournalLine line(int number, Account account, String debit, String credit) {
        return new JournalLine(UUID.randomUUID(), UUID.randomUUID(), number, account.getId(), null,
            new BigDecimal(debit), new BigDecimal(credit));
    }

    private static BigDecimal delta(BalanceMaterializer.AccountPosting posting) {
        return posting.getAccount().getNormalBalance().signedDelta(posting.getDebit(), posting.getCredit());
    }

    @Test
    @DisplayName("Lines are netted per account and signed by normal balance")
    void postingsAreNetted() {
        Account cash = account(AccountType.ASSET);
        Account revenue = account(AccountType.REVENUE);
        Account tax = account(AccountType.LIABILITY);

        List<JournalLine> lines = List.of(
            line(1, cash, "110.00", "0"),
            line(2, revenue, "0", "100.00"),
            line(3, tax, "0", "10.00"),
            line(4, cash, "0", "5.00"),
            line(5, revenue, "5.00", "0")
        );

        Map<UUID, BigDecimal> deltas = new HashMap<>();
        BalanceMaterializer.aggregatePostings(lines, Map.of(cash.getId(), cash, revenue.getId(), revenue, tax.getId(), tax))
            .forEach(p -> deltas.put(p.getAccount().getId(), delta(p)));

        assertEquals(3, deltas.size());
        assertEquals(0, deltas.get(cash.getId()).compareTo(new BigDecimal("105.00")));
        assertEquals(0, deltas.get(revenue.getId()).compareTo(new BigDecimal("95.00")));
        assertEquals(0, deltas.get(tax.getId()).compareTo(new BigDecimal("10.00")));
    }

    @Test
    @DisplayName("Accounts are applied in ascending id order")
    void postingsAreOrderedById() {
        List<Account> accounts = new ArrayList<>();
        List<JournalLine> lines = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Account account = account(AccountType.EXPENSE);
            accounts.add(account);
            lines.add(line(i + 1, account, "1.00", "0"));
        }
        Map<UUID, Account> byId = new HashMap<>();
        accounts.forEach(a -> byId.put(a.getId(), a));

        List<UUID> order = BalanceMaterializer.aggregatePostings(lines, byId).stream()
            .map(p -> p.getAccount().getId())
            .toList();

        List<UUID> sorted = new ArrayList<>(order);
        sorted.sort(null);
        assertEquals(sorted, order);
    }

    @Test
    @DisplayName("A line whose account was not loaded is a programming error")
    void missingAccountFails() {
        Account cash = account(AccountType.ASSET);
        List<JournalLine> lines = List.of(line(1, cash, "1.00", "0"));

        assertThrows(IllegalStateException.class, () -> BalanceMaterializer.aggregatePostings(lines, Map.of()));
    }

    @Test
    @DisplayName("A debit lowers a credit-normal balance and only an active account is updated")
    void applyPostingSignsAndGuardsActive() {
        Account payable = account(AccountType.LIABILITY);
        BigDecimal expected = new BigDecimal("10.00").negate();
        when(jdbcTemplate.update(contains("is_active"), eq(expected), eq(payable.getId()))).thenReturn(1);

        new BalanceMaterializer(jdbcTemplate).applyPosting(payable, new BigDecimal("10.00"), BigDecimal.ZERO);

        verify(jdbcTemplate).update(contains("is_active"), eq(expected), eq(payable.getId()));
    }

    @Test
    @DisplayName("An account deactivated after validation fails the posting")
    void deactivatedAccountRejected() {
        Account cash = account(AccountType.ASSET);
        when(jdbcTemplate.update(anyString(), eq(new BigDecimal("5.00")), eq(cash.getId()))).thenReturn(0);

        LedgerValidationException e = assertThrows(LedgerValidationException.class, () ->
            new BalanceMaterializer(jdbcTemplate).applyPosting(cash, new BigDecimal("5.00"), BigDecimal.ZERO));

        assertTrue(e.getViolations().get(0).contains(cash.getCode()));
    }

    @Test
    @DisplayName("applyLines posts each account's netted pair in id order")
    void applyLinesUsesPostings() {
        Account first = account(AccountType.ASSET);
        Account second = account(AccountType.REVENUE);
        if (first.getId().compareTo(second.getId()) > 0) {
            Account swap = first;
            first = second;
            second = swap;
        }
        List<JournalLine> lines = List.of(
            line(1, second, "0", "40.00"),
            line(2, first, "40.00", "0")
        );
        BigDecimal firstDelta = first.getNormalBalance().signedDelta(new BigDecimal("40.00"), new BigDecimal("0"));
        BigDecimal secondDelta = second.getNormalBalance().signedDelta(new BigDecimal("0"), new BigDecimal("40.00"));
        when(jdbcTemplate.update(anyString(), eq(firstDelta), eq(first.getId()))).thenReturn(1);
        when(jdbcTemplate.update(anyString(), eq(secondDelta), eq(second.getId()))).thenReturn(1);

        new BalanceMaterializer(jdbcTemplate).applyLines(lines, Map.of(first.getId(), first, second.getId(), second));

        InOrder order = inOrder(jdbcTemplate);
        order.verify(jdbcTemplate).update(anyString(), eq(firstDelta), eq(first.getId()));
        order.verify(jdbcTemplate).update(anyString(), eq(secondDelta), eq(second.getId()));
    }
}
