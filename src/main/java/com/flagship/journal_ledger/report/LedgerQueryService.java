package com.flagship.journal_ledger.report;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountCatalog;
import com.flagship.journal_ledger.account.NormalBalance;
import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalEntryStore;
import com.flagship.journal_ledger.journal.JournalStatus;
import com.flagship.journal_ledger.journal.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only views over the journal.
 *
 * Balances are computed from journal lines rather than the materialized
 * {@code current_balance}, so any past date can be reported. Only posted
 * entries are visible (reversed ones included, since they were posted and
 * their reversal entries offset them) unless drafts are asked for.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class LedgerQueryService {

    private static final Set<JournalStatus> POSTED_STATUSES = EnumSet.of(JournalStatus.POSTED, JournalStatus.REVERSED);

    private final AccountCatalog accountCatalog;
    private final JournalEntryStore store;
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final BigDecimal tolerance;

    public LedgerQueryService(AccountCatalog accountCatalog,
                              JournalEntryStore store,
                              NamedParameterJdbcTemplate jdbcTemplate,
                              LedgerProperties properties) {
        this.accountCatalog = accountCatalog;
        this.store = store;
        this.jdbcTemplate = jdbcTemplate;
        this.tolerance = properties.getBalanceTolerance();
    }

    /**
     * Balances of every account from entries dated on or before {@code asOf}.
     * Header accounts roll up the balances of all their descendants.
     */
    public AccountBalancesReport getAccountBalances(LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now();

        Map<UUID, BigDecimal[]> sums = new HashMap<>();
        jdbcTemplate.query(
            "SELECT l.account_id, SUM(l.debit_amount) AS debits, SUM(l.credit_amount) AS credits " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE e.status IN (:statuses) AND e.entry_date <= :asOf GROUP BY l.account_id",
            new MapSqlParameterSource()
                .addValue("statuses", names(POSTED_STATUSES))
                .addValue("asOf", Date.valueOf(date)),
            rs -> {
                sums.put(UUID.fromString(rs.getString("account_id")),
                    new BigDecimal[]{rs.getBigDecimal("debits"), rs.getBigDecimal("credits")});
            });

        List<Account> accounts = accountCatalog.findAll();
        Map<UUID, List<Account>> children = new HashMap<>();
        for (Account account : accounts) {
            if (account.getParentId() != null) {
                children.computeIfAbsent(account.getParentId(), k -> new ArrayList<>()).add(account);
            }
        }

        Map<UUID, BigDecimal[]> rolledUp = new HashMap<>();
        List<AccountBalanceLine> lines = new ArrayList<>(accounts.size());
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;

        for (Account account : accounts) {
            BigDecimal[] totals = rollUp(account, sums, children, rolledUp);
            BigDecimal balance = account.getNormalBalance().signedDelta(totals[0], totals[1]);
            lines.add(new AccountBalanceLine(account.getId(), account.getCode(), account.getName(),
                account.getType(), account.getParentId(), account.isHeader(), totals[0], totals[1], balance));

            if (!account.isHeader()) {
                BigDecimal net = totals[0].subtract(totals[1]);
                if (net.signum() >= 0) {
                    totalDebits = totalDebits.add(net);
                } else {
                    totalCredits = totalCredits.add(net.negate());
                }
            }
        }

        log.debug("Balance report built: asOf={}, accounts={}", date, lines.size());
        return new AccountBalancesReport(date, lines, totalDebits, totalCredits);
    }

    /**
     * Entries journaled for a source record, oldest first.
     */
    public List<JournalEntryResult> getEntriesBySource(SourceType sourceType, long sourceId, boolean includeDrafts) {
        return store.findBySource(sourceType, sourceId, visibleStatuses(includeDrafts)).stream()
            .map(entry -> JournalEntryResult.from(entry, tolerance, false))
            .toList();
    }

    /**
     * Lines posted to an account between {@code from} and {@code to} inclusive,
     * with the balance carried into the range and the running balance after each line.
     * Either bound may be null for an open range.
     *
     * @throws IllegalArgumentException if the account does not exist or the range is inverted
     */
    public AccountLedger getLedgerForAccount(UUID accountId, LocalDate from, LocalDate to, boolean includeDrafts) {
        Account account = accountCatalog.findById(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        NormalBalance side = account.getNormalBalance();

        BigDecimal opening = BigDecimal.ZERO;
        if (from != null) {
            Map<String, Object> sums = jdbcTemplate.queryForMap(
                "SELECT COALESCE(SUM(l.debit_amount), 0) AS debits, COALESCE(SUM(l.credit_amount), 0) AS credits " +
                "FROM journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
                "WHERE l.account_id = :accountId AND e.status IN (:statuses) AND e.entry_date < :from",
                new MapSqlParameterSource()
                    .addValue("accountId", accountId)
                    .addValue("statuses", names(POSTED_STATUSES))
                    .addValue("from", Date.valueOf(from)));
            opening = side.signedDelta((BigDecimal) sums.get("debits"), (BigDecimal) sums.get("credits"));
        }

        StringBuilder sql = new StringBuilder(
            "SELECT e.id AS entry_id, e.entry_number, e.entry_date, e.status, e.description AS entry_description, " +
            "l.description AS line_description, l.debit_amount, l.credit_amount " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE l.account_id = :accountId AND e.status IN (:statuses)");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("statuses", names(visibleStatuses(includeDrafts)));
        if (from != null) {
            sql.append(" AND e.entry_date >= :from");
            params.addValue("from", Date.valueOf(from));
        }
        if (to != null) {
            sql.append(" AND e.entry_date <= :to");
            params.addValue("to", Date.valueOf(to));
        }
        sql.append(" ORDER BY e.entry_date, e.entry_number, l.line_number");

        List<AccountLedgerLine> lines = new ArrayList<>();
        BigDecimal[] running = {opening};
        jdbcTemplate.query(sql.toString(), params, rs -> {
            JournalStatus status = JournalStatus.valueOf(rs.getString("status"));
            BigDecimal debit = rs.getBigDecimal("debit_amount");
            BigDecimal credit = rs.getBigDecimal("credit_amount");
            if (status.affectsBalances()) {
                running[0] = running[0].add(side.signedDelta(debit, credit));
            }
            lines.add(new AccountLedgerLine(
                UUID.fromString(rs.getString("entry_id")),
                rs.getString("entry_number"),
                rs.getDate("entry_date").toLocalDate(),
                status,
                rs.getString("entry_description"),
                rs.getString("line_description"),
                debit,
                credit,
                running[0]));
        });

        return new AccountLedger(account.getId(), account.getCode(), account.getName(), side,
            from, to, opening, lines, running[0]);
    }

    private BigDecimal[] rollUp(Account account,
                                Map<UUID, BigDecimal[]> sums,
                                Map<UUID, List<Account>> children,
                                Map<UUID, BigDecimal[]> memo) {
        BigDecimal[] cached = memo.get(account.getId());
        if (cached != null) {
            return cached;
        }
        BigDecimal[] own = sums.getOrDefault(account.getId(), new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
        BigDecimal debits = own[0];
        BigDecimal credits = own[1];
        for (Account child : children.getOrDefault(account.getId(), List.of())) {
            BigDecimal[] childTotals = rollUp(child, sums, children, memo);
            debits = debits.add(childTotals[0]);
            credits = credits.add(childTotals[1]);
        }
        BigDecimal[] totals = {debits, credits};
        memo.put(account.getId(), totals);
        return totals;
    }

    private static Set<JournalStatus> visibleStatuses(boolean includeDrafts) {
        if (!includeDrafts) {
            return POSTED_STATUSES;
        }
        return EnumSet.allOf(JournalStatus.class);
    }

    private static List<String> names(Set<JournalStatus> statuses) {
        return statuses.stream().map(Enum::name).toList();
    }
}
