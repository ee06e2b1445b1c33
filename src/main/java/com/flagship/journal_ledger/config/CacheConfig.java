package com.flagship.journal_ledger.config;

import com.flagship.journal_ledger.account.Account;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * In-process caches.
 *
 * The account lookup cache maps account codes to accounts for the source
 * adapters. Entries expire after a short TTL and are invalidated explicitly by
 * every catalog write, so the cache never outlives a deactivation by more than
 * the in-flight request.
 */
@Configuration
@Slf4j
public class CacheConfig {

    public static final String ACCOUNT_LOOKUP_CACHE = "accountLookup";

    @Bean
    public Cache<String, Account> accountLookupCache(LedgerProperties properties, MeterRegistry meterRegistry) {
        LedgerProperties.AccountCache settings = properties.getAccountCache();
        log.info("Configuring account lookup cache: ttl={}s, maxSize={}",
                settings.getTtlSeconds(), settings.getMaximumSize());

        Cache<String, Account> cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(settings.getTtlSeconds()))
                .maximumSize(settings.getMaximumSize())
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, ACCOUNT_LOOKUP_CACHE);
        return cache;
    }
}
