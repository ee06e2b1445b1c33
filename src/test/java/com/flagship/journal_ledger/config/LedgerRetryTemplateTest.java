package com.flagship.journal_ledger.config;

import com.flagship.journal_ledger.exception.LedgerValidationException;
import com.flagship.journal_ledger.exception.SequenceContentionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LedgerRetryTemplateTest {

    private LedgerRetryTemplate retryTemplate;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialIntervalMs(1);
        properties.getRetry().setMaxIntervalMs(5);
        retryTemplate = new LedgerRetryTemplate(properties);
    }

    @Test
    @DisplayName("Contention is retried until the call succeeds")
    void contentionRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryTemplate.execute("create", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new SequenceContentionException("JE", null);
            }
            return "JE-00001";
        });

        assertEquals("JE-00001", result);
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Contention that outlasts the attempts is rethrown")
    void contentionExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(SequenceContentionException.class, () -> retryTemplate.execute("create", () -> {
            calls.incrementAndGet();
            throw new SequenceContentionException("JE", null);
        }));
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Validation failures are not retried")
    void validationNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(LedgerValidationException.class, () -> retryTemplate.execute("create", () -> {
            calls.incrementAndGet();
            throw new LedgerValidationException("entry is unbalanced");
        }));
        assertEquals(1, calls.get());
    }
}
