package com.flagship.journal_ledger.account;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chart of accounts backed by the {@code accounts} table.
 *
 * All reads here go to the database. Callers that can tolerate a slightly
 * stale view use {@link AccountLookupCache}; the posting engine always uses
 * this class so that an account deactivated a moment ago is rejected.
 *
 * The catalog never touches {@code current_balance}; that column belongs to
 * the balance materializer.
 */
@Service
@Slf4j
public class AccountCatalog {

    private static final String SELECT_ACCOUNT =
        "SELECT id, code, name, account_type, parent_id, is_header, is_active, " +
        "current_balance, balance_updated_at FROM accounts";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final Cache<String, Account> lookupCache;

    public AccountCatalog(JdbcTemplate jdbcTemplate, Cache<String, Account> accountLookupCache) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.lookupCache = accountLookupCache;
    }

    /**
     * Creates a postable (non-header) account.
     */
    @Transactional
    public Account createAccount(String code, String name, AccountType type, UUID parentId) {
        return createAccount(code, name, type, parentId, false);
    }

    @Transactional
    public Account createAccount(String code, String name, AccountType type, UUID parentId, boolean header) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        if (parentId != null) {
            Account parent = findById(parentId)
                .orElseThrow(() -> new IllegalArgumentException("Parent account not found: " + parentId));
            if (parent.getType() != type) {
                throw new IllegalArgumentException(String.format(
                    "Account %s of type %s cannot sit under %s of type %s",
                    code, type, parent.getCode(), parent.getType()));
            }
        }

        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, code, name, account_type, parent_id, is_header, is_active, current_balance) " +
            "VALUES (?, ?, ?, ?, ?, ?, TRUE, 0)",
            id, code, name, type.name(), parentId, header
        );
        invalidateAfterCommit(code);

        log.info("Created account: code={}, type={}, header={}", code, type, header);
        return findById(id).orElseThrow();
    }

    /**
     * Applies a typed update. The account leaves the lookup cache once the update commits.
     */
    @Transactional
    public Account update(UUID accountId, AccountUpdate update) {
        Account existing = findById(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));

        if (update == null || update.isEmpty()) {
            return existing;
        }

        jdbcTemplate.update(
            "UPDATE accounts SET name = COALESCE(?, name), is_active = COALESCE(?, is_active), " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            update.getName(), update.getActive(), accountId
        );
        invalidateAfterCommit(existing.getCode());

        log.info("Updated account: code={}, name={}, active={}",
                existing.getCode(), update.getName(), update.getActive());
        return findById(accountId).orElseThrow();
    }

    public Optional<Account> findById(UUID accountId) {
        List<Account> result = jdbcTemplate.query(SELECT_ACCOUNT + " WHERE id = ?", accountRowMapper(), accountId);
        return result.stream().findFirst();
    }

    public Optional<Account> findByCode(String code) {
        List<Account> result = jdbcTemplate.query(SELECT_ACCOUNT + " WHERE code = ?", accountRowMapper(), code);
        return result.stream().findFirst();
    }

    /**
     * Loads the given accounts in one query. Unknown ids are simply absent from the map.
     */
    public Map<UUID, Account> findAllByIds(Collection<UUID> accountIds) {
        Map<UUID, Account> accounts = new LinkedHashMap<>();
        if (accountIds == null || accountIds.isEmpty()) {
            return accounts;
        }
        MapSqlParameterSource params = new MapSqlParameterSource("ids", accountIds);
        namedJdbcTemplate.query(SELECT_ACCOUNT + " WHERE id IN (:ids)", params, accountRowMapper())
            .forEach(account -> accounts.put(account.getId(), account));
        return accounts;
    }

    public List<Account> findAll() {
        return jdbcTemplate.query(SELECT_ACCOUNT + " ORDER BY code", accountRowMapper());
    }

    public List<UUID> findAllPostableIds() {
        return jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE is_header = FALSE ORDER BY code", UUID.class);
    }

    public Optional<AccountBalanceSnapshot> getBalanceSnapshot(UUID accountId) {
        return findById(accountId).map(account -> new AccountBalanceSnapshot(
            account.getId(), account.getCode(), account.getCurrentBalance(), account.getBalanceUpdatedAt()));
    }

    /**
     * The cache never holds a row older than the last committed update.
     */
    private void invalidateAfterCommit(String code) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            lookupCache.invalidate(code);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                lookupCache.invalidate(code);
            }
        });
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp balanceUpdatedAt = rs.getTimestamp("balance_updated_at");
            String parentId = rs.getString("parent_id");
            return new Account(
                UUID.fromString(rs.getString("id")),
                rs.getString("code"),
                rs.getString("name"),
                AccountType.valueOf(rs.getString("account_type")),
                parentId != null ? UUID.fromString(parentId) : null,
                rs.getBoolean("is_header"),
                rs.getBoolean("is_active"),
                rs.getBigDecimal("current_balance"),
                balanceUpdatedAt != null ? balanceUpdatedAt.toInstant() : null
            );
        };
    }
}
