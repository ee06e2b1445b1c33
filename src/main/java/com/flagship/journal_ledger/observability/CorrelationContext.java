package com.flagship.journal_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID of the work the current thread is doing, mirrored into MDC.
 *
 * Two kinds of work open a scope: HTTP requests ({@link CorrelationIdFilter})
 * and posting tasks run by the background worker. Ledger code below them adds
 * the entry, source or account it is handling under the keys defined here,
 * and closing the scope clears all of them.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String SOURCE_MDC_KEY = "source";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final String TASK_PREFIX = "task-";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Binds {@code id} (or a fresh one when blank) to this thread until the returned scope closes.
     */
    public static Scope open(String id) {
        String bound = id != null && !id.isBlank() ? id : generateCorrelationId();
        correlationId.set(bound);
        MDC.put(CORRELATION_ID_MDC_KEY, bound);
        return new Scope(bound);
    }

    /**
     * Scope for one attempt of a deferred posting, tagged with the task it belongs to.
     */
    public static Scope openForPostingTask(UUID taskId) {
        return open(TASK_PREFIX + taskId.toString().substring(0, 8));
    }

    /**
     * The bound correlation ID, or null outside any scope.
     */
    public static String getCorrelationId() {
        return correlationId.get();
    }

    /**
     * Tags log lines with the source document being journaled.
     */
    public static void putSource(Object sourceType, Long sourceId) {
        if (sourceId != null) {
            MDC.put(SOURCE_MDC_KEY, sourceType + ":" + sourceId);
        }
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Closing clears the correlation ID and every ledger key put into MDC while it was open.
     */
    public static final class Scope implements AutoCloseable {

        private final String id;

        private Scope(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }

        @Override
        public void close() {
            correlationId.remove();
            MDC.remove(CORRELATION_ID_MDC_KEY);
            MDC.remove(ENTRY_ID_MDC_KEY);
            MDC.remove(SOURCE_MDC_KEY);
            MDC.remove(ACCOUNT_ID_MDC_KEY);
        }
    }
}
