package com.flagship.journal_ledger.config;

import com.flagship.journal_ledger.journal.SourceType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed configuration for the ledger, bound from the {@code ledger.*} namespace.
 * Defaults match {@code application.yml}.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * Maximum tolerated |debits - credits| for an entry to count as balanced.
     */
    private BigDecimal balanceTolerance = new BigDecimal("0.005");

    private Numbering numbering = new Numbering();
    private Retry retry = new Retry();
    private AccountCache accountCache = new AccountCache();
    private Idempotency idempotency = new Idempotency();
    private PostingQueue postingQueue = new PostingQueue();
    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Numbering {
        private long lockTimeoutMs = 2000;
        private String defaultPrefix = "JE";
        private Map<SourceType, String> prefixes = defaultPrefixes();

        public String prefixFor(SourceType sourceType) {
            String prefix = prefixes.get(sourceType);
            return prefix != null && !prefix.isBlank() ? prefix : defaultPrefix;
        }

        private static Map<SourceType, String> defaultPrefixes() {
            Map<SourceType, String> prefixes = new EnumMap<>(SourceType.class);
            prefixes.put(SourceType.MANUAL, "JE");
            prefixes.put(SourceType.SALES, "SJ");
            prefixes.put(SourceType.PURCHASE, "PJ");
            prefixes.put(SourceType.PAYMENT, "PY");
            prefixes.put(SourceType.REVERSAL, "RV");
            prefixes.put(SourceType.CLOSING, "CL");
            prefixes.put(SourceType.ADJUSTMENT, "AJ");
            return prefixes;
        }
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 4;
        private long initialIntervalMs = 50;
        private double multiplier = 2.0;
        private long maxIntervalMs = 1000;
    }

    @Getter
    @Setter
    public static class AccountCache {
        private long ttlSeconds = 30;
        private long maximumSize = 2000;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private boolean redisEnabled = true;
        private long ttlHours = 168;
    }

    @Getter
    @Setter
    public static class PostingQueue {
        private boolean enabled = true;
        private int batchSize = 20;
        private int maxAttempts = 8;
        private long baseBackoffMs = 1000;
        private long maxBackoffMs = 300_000;
        private int attemptTimeoutSeconds = 10;
        private long defaultDeadlineHours = 24;
        private long leaseSeconds = 60;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;
        private boolean autoHeal = true;
    }
}
