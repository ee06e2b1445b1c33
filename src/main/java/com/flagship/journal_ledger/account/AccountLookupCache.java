package com.flagship.journal_ledger.account;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Code-to-account resolution for the source adapters, backed by a Caffeine cache.
 *
 * Cached accounts carry whatever balance they had when loaded; only use them
 * for identity and classification. Misses are not cached, so a newly created
 * account becomes visible immediately.
 */
@Component
@Slf4j
public class AccountLookupCache {

    private final Cache<String, Account> cache;
    private final AccountCatalog catalog;

    public AccountLookupCache(Cache<String, Account> accountLookupCache, AccountCatalog catalog) {
        this.cache = accountLookupCache;
        this.catalog = catalog;
    }

    public Optional<Account> findByCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        Account cached = cache.getIfPresent(code);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Account> loaded = catalog.findByCode(code);
        loaded.ifPresent(account -> cache.put(code, account));
        log.debug("Account lookup cache miss: code={}, found={}", code, loaded.isPresent());
        return loaded;
    }
}
