package com.flagship.journal_ledger.adapter;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountLookupCache;
import com.flagship.journal_ledger.account.AccountType;
import com.flagship.journal_ledger.journal.JournalLineRequest;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * In-memory chart of accounts behind a mocked {@link AccountLookupCache}.
 */
class ChartOfAccountsFixture {

    private final Map<String, Account> byCode = new HashMap<>();

    ChartOfAccountsFixture() {
        add("1100", AccountType.ASSET, true, true);
        add(ChartOfAccountsCodes.CASH, AccountType.ASSET, false, true);
        add(ChartOfAccountsCodes.BANK, AccountType.ASSET, false, true);
        add("1103", AccountType.ASSET, false, true);
        add(ChartOfAccountsCodes.ACCOUNTS_RECEIVABLE, AccountType.ASSET, false, true);
        add(ChartOfAccountsCodes.VAT_INPUT, AccountType.ASSET, false, true);
        add(ChartOfAccountsCodes.INVENTORY, AccountType.ASSET, false, true);
        add(ChartOfAccountsCodes.ACCOUNTS_PAYABLE, AccountType.LIABILITY, false, true);
        add(ChartOfAccountsCodes.VAT_OUTPUT, AccountType.LIABILITY, false, true);
        add(ChartOfAccountsCodes.PPH21_PAYABLE, AccountType.LIABILITY, false, true);
        add(ChartOfAccountsCodes.PPH23_PAYABLE, AccountType.LIABILITY, false, true);
        add(ChartOfAccountsCodes.SALES_REVENUE, AccountType.REVENUE, false, true);
        add(ChartOfAccountsCodes.COST_OF_GOODS_SOLD, AccountType.EXPENSE, false, true);
        add("6101", AccountType.EXPENSE, false, true);
    }

    Account add(String code, AccountType type, boolean header, boolean active) {
        Account account = new Account(UUID.randomUUID(), code, "Account " + code, type, null, header, active,
            BigDecimal.ZERO, null);
        byCode.put(code, account);
        return account;
    }

    void remove(String code) {
        byCode.remove(code);
    }

    UUID id(String code) {
        return byCode.get(code).getId();
    }

    void stub(AccountLookupCache lookup) {
        when(lookup.findByCode(any())).thenAnswer(inv -> Optional.ofNullable(byCode.get(inv.<String>getArgument(0))));
    }

    static BigDecimal debits(List<JournalLineRequest> lines) {
        return lines.stream().map(JournalLineRequest::getDebitAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static BigDecimal credits(List<JournalLineRequest> lines) {
        return lines.stream().map(JournalLineRequest::getCreditAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static Optional<JournalLineRequest> lineFor(List<JournalLineRequest> lines, UUID accountId) {
        return lines.stream().filter(l -> accountId.equals(l.getAccountId())).findFirst();
    }
}
