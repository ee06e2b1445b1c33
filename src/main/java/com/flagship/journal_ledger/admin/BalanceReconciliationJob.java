package com.flagship.journal_ledger.admin;

import com.flagship.journal_ledger.account.AccountCatalog;
import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.journal.BalanceMaterializer;
import com.flagship.journal_ledger.journal.BalanceRecomputation;
import com.flagship.journal_ledger.observability.CorrelationContext;
import com.flagship.journal_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Periodically compares every materialized balance with the sum of its journal lines.
 *
 * Each account is checked in its own short transaction so one slow account
 * does not hold locks on the rest. With auto-heal on, drifted balances are
 * overwritten from the journal.
 */
@Component
@Slf4j
public class BalanceReconciliationJob {

    private final AccountCatalog accountCatalog;
    private final BalanceMaterializer balanceMaterializer;
    private final LedgerMetrics metrics;
    private final LedgerProperties.Reconciliation settings;

    public BalanceReconciliationJob(AccountCatalog accountCatalog,
                                    BalanceMaterializer balanceMaterializer,
                                    LedgerMetrics metrics,
                                    LedgerProperties properties) {
        this.accountCatalog = accountCatalog;
        this.balanceMaterializer = balanceMaterializer;
        this.metrics = metrics;
        this.settings = properties.getReconciliation();
    }

    @Scheduled(fixedDelayString = "${ledger.reconciliation.interval-ms:1800000}",
               initialDelayString = "${ledger.reconciliation.interval-ms:1800000}")
    public void scheduledRun() {
        if (!settings.isEnabled()) {
            return;
        }
        try {
            runOnce(settings.isAutoHeal());
        } catch (Exception e) {
            log.error("Balance reconciliation run failed", e);
        }
    }

    /**
     * Checks all postable accounts.
     *
     * @param heal whether drifted balances are rewritten from the journal
     */
    public BalanceHealthReport runOnce(boolean heal) {
        long startTime = System.currentTimeMillis();
        List<UUID> accountIds = accountCatalog.findAllPostableIds();
        List<BalanceRecomputation> drifted = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();

        for (UUID accountId : accountIds) {
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId.toString());
            try {
                BalanceRecomputation result = heal
                    ? balanceMaterializer.recompute(accountId)
                    : balanceMaterializer.verify(accountId);
                if (result.hasDrift()) {
                    drifted.add(result);
                    metrics.recordBalanceDrift(result.isHealed());
                }
            } catch (DataAccessException e) {
                log.error("Balance check failed for account {}: {}", accountId, e.getMessage());
                failed.add(accountId);
            } finally {
                MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        if (drifted.isEmpty() && failed.isEmpty()) {
            log.info("Balance reconciliation clean: accounts={}, duration={}ms", accountIds.size(), duration);
        } else {
            log.warn("Balance reconciliation found problems: accounts={}, drifted={}, failed={}, healed={}, duration={}ms",
                    accountIds.size(), drifted.size(), failed.size(), heal, duration);
        }
        return new BalanceHealthReport(Instant.now(), accountIds.size(), List.copyOf(drifted), List.copyOf(failed), heal);
    }
}
