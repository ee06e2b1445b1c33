package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountType;
import com.flagship.journal_ledger.account.NormalBalance;
import com.flagship.journal_ledger.exception.BalanceContentionException;
import com.flagship.journal_ledger.exception.LedgerValidationException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Keeps {@code accounts.current_balance} in step with posted journal lines.
 *
 * Only this class writes the column. Updates are relative
 * ({@code current_balance = current_balance + delta}) so each one takes the
 * account's row lock and no concurrent posting can be lost. When an entry
 * touches several accounts, deltas are applied in ascending account id order
 * so two postings can never wait on each other's rows in opposite order.
 */
@Component
@Slf4j
public class BalanceMaterializer {

    private final JdbcTemplate jdbcTemplate;

    public BalanceMaterializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Applies one debit/credit pair to an account, signed by its normal balance.
     *
     * The update only matches an active, postable account. An account
     * deactivated after the entry was validated fails the whole posting.
     *
     * @throws LedgerValidationException if the account is no longer postable
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyPosting(Account account, BigDecimal debitDelta, BigDecimal creditDelta) {
        BigDecimal delta = account.getNormalBalance().signedDelta(debitDelta, creditDelta);
        try {
            int updated = jdbcTemplate.update(
                "UPDATE accounts SET current_balance = current_balance + ?, " +
                "balance_updated_at = CURRENT_TIMESTAMP WHERE id = ? AND is_active AND NOT is_header",
                delta, account.getId()
            );
            if (updated != 1) {
                log.warn("Account no longer postable at balance update: account={}", account.getCode());
                throw new LedgerValidationException(
                    "account " + account.getCode() + " is no longer active; nothing was posted");
            }
        } catch (PessimisticLockingFailureException e) {
            log.warn("Balance update contention: account={}, error={}", account.getCode(), e.getMessage());
            throw new BalanceContentionException("Timed out updating balance of account " + account.getCode(), e);
        }
    }

    /**
     * Applies every line of a posted entry. Lines on the same account are netted first.
     *
     * @param accountsById accounts referenced by the lines, used for their normal balance
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyLines(Collection<JournalLine> lines, Map<UUID, Account> accountsById) {
        List<AccountPosting> postings = aggregatePostings(lines, accountsById);
        for (AccountPosting posting : postings) {
            applyPosting(posting.getAccount(), posting.getDebit(), posting.getCredit());
        }
        log.debug("Materialized balances for {} accounts", postings.size());
    }

    /**
     * Debit and credit totals per account, ordered by account id.
     */
    static List<AccountPosting> aggregatePostings(Collection<JournalLine> lines, Map<UUID, Account> accountsById) {
        Map<UUID, AccountPosting> postings = new TreeMap<>();
        for (JournalLine line : lines) {
            Account account = accountsById.get(line.getAccountId());
            if (account == null) {
                throw new IllegalStateException("No account loaded for line " + line.getLineNumber());
            }
            AccountPosting posting = new AccountPosting(account, line.getDebitAmount(), line.getCreditAmount());
            postings.merge(account.getId(), posting, AccountPosting::plus);
        }
        return List.copyOf(postings.values());
    }

    @Value
    static class AccountPosting {
        Account account;
        BigDecimal debit;
        BigDecimal credit;

        AccountPosting plus(AccountPosting other) {
            return new AccountPosting(account, debit.add(other.debit), credit.add(other.credit));
        }
    }

    /**
     * Derives the balance from the journal and overwrites the stored value.
     *
     * Sums lines of every entry that was ever posted, reversed ones included,
     * since their reversal entries carry the offsetting lines.
     */
    @Transactional
    public BalanceRecomputation recompute(UUID accountId) {
        return reconcile(accountId, true);
    }

    /**
     * Same comparison as {@link #recompute} without writing anything.
     */
    @Transactional(readOnly = true)
    public BalanceRecomputation verify(UUID accountId) {
        return reconcile(accountId, false);
    }

    private BalanceRecomputation reconcile(UUID accountId, boolean heal) {
        String lockClause = heal ? " FOR UPDATE" : "";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT code, account_type, current_balance FROM accounts WHERE id = ?" + lockClause, accountId);
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        Map<String, Object> row = rows.get(0);
        String code = (String) row.get("code");
        NormalBalance normalBalance = AccountType.valueOf((String) row.get("account_type")).normalBalance();
        BigDecimal stored = (BigDecimal) row.get("current_balance");

        Map<String, Object> sums = jdbcTemplate.queryForMap(
            "SELECT COALESCE(SUM(l.debit_amount), 0) AS debits, COALESCE(SUM(l.credit_amount), 0) AS credits " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE l.account_id = ? AND e.status IN ('POSTED', 'REVERSED')",
            accountId
        );
        BigDecimal journal = normalBalance.signedDelta((BigDecimal) sums.get("debits"), (BigDecimal) sums.get("credits"));

        boolean drifted = stored.compareTo(journal) != 0;
        boolean healed = false;
        if (drifted) {
            log.warn("Balance drift detected: account={}, stored={}, journal={}", code, stored, journal);
            if (heal) {
                jdbcTemplate.update(
                    "UPDATE accounts SET current_balance = ?, balance_updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                    journal, accountId);
                healed = true;
                log.info("Balance healed: account={}, balance={}", code, journal);
            }
        }
        return new BalanceRecomputation(accountId, code, stored, journal, healed);
    }
}
