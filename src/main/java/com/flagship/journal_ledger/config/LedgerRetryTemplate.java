package com.flagship.journal_ledger.config;

import com.flagship.journal_ledger.exception.LedgerConcurrencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retries ledger operations that failed on lock contention.
 *
 * Only {@link LedgerConcurrencyException} is retried, with exponential backoff.
 * Must be used outside any transaction: each attempt has to start a fresh one,
 * since the failed attempt's transaction was rolled back.
 */
@Component
@Slf4j
public class LedgerRetryTemplate {

    private final RetryTemplate retryTemplate;

    public LedgerRetryTemplate(LedgerProperties properties) {
        LedgerProperties.Retry retry = properties.getRetry();
        this.retryTemplate = RetryTemplate.builder()
            .maxAttempts(retry.getMaxAttempts())
            .exponentialBackoff(retry.getInitialIntervalMs(), retry.getMultiplier(), retry.getMaxIntervalMs())
            .retryOn(LedgerConcurrencyException.class)
            .traversingCauses()
            .withListener(new ContentionLogger())
            .build();
    }

    public <T> T execute(String operation, Supplier<T> action) {
        return retryTemplate.execute(context -> {
            context.setAttribute(RetryContext.NAME, operation);
            return action.get();
        });
    }

    private static class ContentionLogger implements RetryListener {
        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            log.warn("Ledger {} hit contention, attempt {}: {}",
                    context.getAttribute(RetryContext.NAME), context.getRetryCount(), throwable.getMessage());
        }
    }
}
