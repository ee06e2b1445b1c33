package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountCatalog;
import com.flagship.journal_ledger.config.LedgerProperties;
import com.flagship.journal_ledger.exception.JournalEntryNotFoundException;
import com.flagship.journal_ledger.exception.LedgerConcurrencyException;
import com.flagship.journal_ledger.exception.LedgerException;
import com.flagship.journal_ledger.exception.LedgerStateException;
import com.flagship.journal_ledger.exception.LedgerValidationException;
import com.flagship.journal_ledger.journal.event.JournalEntryPostedEvent;
import com.flagship.journal_ledger.journal.event.JournalEntryReversedEvent;
import com.flagship.journal_ledger.observability.CorrelationContext;
import com.flagship.journal_ledger.observability.LedgerMetrics;
import com.flagship.journal_ledger.outbox.OutboxService;
import com.flagship.journal_ledger.period.AccountingPeriodService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates, posts and reverses journal entries.
 *
 * Every operation is one database transaction: validation, number allocation,
 * the entry and its lines, balance materialization and the outbox event all
 * commit together or not at all.
 *
 * Key guarantees:
 * - A POSTED entry always balances within the configured tolerance
 * - Posted history is never edited; a reversal entry cancels it instead
 * - At most one live entry exists per {@code (sourceType, sourceId)}
 * - Account balances move in the same transaction as the lines that justify them
 * - Nothing is written into a closed or locked accounting period
 *
 * Lock contention surfaces as {@link LedgerConcurrencyException} with the
 * transaction rolled back. Retry the whole call from outside any transaction.
 */
@Service
@Slf4j
public class JournalPostingEngine {

    public static final String AGGREGATE_TYPE = "JournalEntry";
    static final String REVERSAL_REFERENCE_PREFIX = "REV-";
    private static final String ACTIVE_SOURCE_INDEX = "uq_journal_entries_active_source";

    private final AccountCatalog accountCatalog;
    private final LedgerValidator validator;
    private final SequenceGenerator sequenceGenerator;
    private final JournalEntryStore store;
    private final BalanceMaterializer balanceMaterializer;
    private final TransactionLocks locks;
    private final AccountingPeriodService periods;
    private final SourceIdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final BigDecimal tolerance;

    public JournalPostingEngine(AccountCatalog accountCatalog,
                                LedgerValidator validator,
                                SequenceGenerator sequenceGenerator,
                                JournalEntryStore store,
                                BalanceMaterializer balanceMaterializer,
                                TransactionLocks locks,
                                AccountingPeriodService periods,
                                SourceIdempotencyService idempotencyService,
                                OutboxService outboxService,
                                LedgerMetrics metrics,
                                LedgerProperties properties) {
        this.accountCatalog = accountCatalog;
        this.validator = validator;
        this.sequenceGenerator = sequenceGenerator;
        this.store = store;
        this.balanceMaterializer = balanceMaterializer;
        this.locks = locks;
        this.periods = periods;
        this.idempotencyService = idempotencyService;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.tolerance = properties.getBalanceTolerance();
    }

    /**
     * Validates and stores a new entry, posting it immediately when {@code autoPost} is set.
     *
     * For a sourced request that already has a live entry, returns that entry
     * with {@code replayed = true} and writes nothing.
     *
     * @throws LedgerValidationException if the entry breaks a bookkeeping rule
     * @throws LedgerConcurrencyException if a lock could not be obtained in time
     */
    @Transactional
    public JournalEntryResult createEntry(JournalEntryRequest request) {
        long startTime = System.currentTimeMillis();
        String sourceType = request.getSourceType().name();

        log.info("Creating journal entry: sourceType={}, sourceId={}, lines={}, autoPost={}",
                sourceType, request.getSourceId(), request.getLines().size(), request.isAutoPost());

        try {
            CorrelationContext.putSource(sourceType, request.getSourceId());
            if (request.hasSource()) {
                Optional<JournalEntryResult> cached = replayFromCache(request);
                if (cached.isPresent()) {
                    return cached.get();
                }
            }

            locks.applyLockTimeout();

            if (request.hasSource()) {
                locks.acquireSourceLock(request.getSourceType(), request.getSourceId());
                Optional<JournalEntry> existing =
                    idempotencyService.findLiveEntry(request.getSourceType(), request.getSourceId());
                if (existing.isPresent()) {
                    return replay(existing.get());
                }
                metrics.recordIdempotencyMiss();
            }

            Map<UUID, Account> accounts = accountCatalog.findAllByIds(accountIds(request.getLines()));
            ValidationResult validation = validator.validate(request, accounts);
            if (!validation.isValid()) {
                metrics.recordValidationFailure(sourceType);
                log.warn("Journal entry rejected: violations={}", validation.getViolations());
                throw new LedgerValidationException(validation);
            }
            periods.assertOpenForPosting(request.getEntryDate());

            Instant now = Instant.now();
            UUID entryId = UUID.randomUUID();
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());

            String entryNumber = sequenceGenerator.nextEntryNumber(request.getSourceType());
            JournalStatus status = request.isAutoPost() ? JournalStatus.POSTED : JournalStatus.DRAFT;

            JournalEntry entry = new JournalEntry(
                entryId,
                entryNumber,
                request.getSourceType(),
                request.getSourceId(),
                request.getReference(),
                request.getEntryDate(),
                request.getDescription(),
                status,
                validation.getTotalDebit(),
                validation.getTotalCredit(),
                request.getCreatedBy(),
                now,
                request.isAutoPost() ? now : null,
                null, null, null, null, null,
                toLines(entryId, request.getLines())
            );

            insert(entry);

            if (entry.getStatus() == JournalStatus.POSTED) {
                balanceMaterializer.applyLines(entry.getLines(), accounts);
                outboxService.saveEvent(AGGREGATE_TYPE, entryId,
                        JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.fromEntry(entry));
                metrics.recordEntryPosted(sourceType);
            }

            if (request.hasSource()) {
                idempotencyService.rememberAfterCommit(request.getSourceType(), request.getSourceId(), entryId);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryCreated(sourceType, status.name());
            metrics.recordLatency("create", "success", duration);

            log.info("Journal entry created: entryNumber={}, status={}, totalDebit={}, totalCredit={}, duration={}ms",
                    entryNumber, status, entry.getTotalDebit(), entry.getTotalCredit(), duration);

            return JournalEntryResult.from(entry, tolerance, false);

        } catch (LedgerException e) {
            recordFailure("create", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
            MDC.remove(CorrelationContext.SOURCE_MDC_KEY);
        }
    }

    /**
     * Moves a DRAFT entry to POSTED and applies its lines to account balances.
     *
     * Lines are re-validated against the current accounts, so a draft whose
     * account was deactivated since it was written cannot be posted. Neither
     * can a draft dated in a period closed since.
     *
     * @throws JournalEntryNotFoundException if no entry has this id
     * @throws LedgerStateException if the entry is already posted or reversed
     */
    @Transactional
    public JournalEntryResult postEntry(UUID entryId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());

        log.info("Posting journal entry");

        try {
            locks.applyLockTimeout();

            JournalEntry draft = store.findByIdForUpdate(entryId)
                .orElseThrow(() -> new JournalEntryNotFoundException(entryId));
            JournalEntry posted = draft.post(Instant.now());

            List<JournalLineRequest> lineRequests = draft.getLines().stream()
                .map(l -> new JournalLineRequest(l.getAccountId(), l.getDescription(), l.getDebitAmount(), l.getCreditAmount()))
                .toList();
            Map<UUID, Account> accounts = accountCatalog.findAllByIds(accountIds(lineRequests));

            ValidationResult validation = validator.validate(JournalEntryRequest.builder()
                .entryDate(draft.getEntryDate())
                .description(draft.getDescription())
                .sourceType(draft.getSourceType())
                .lines(lineRequests)
                .build(), accounts);
            if (!validation.isValid()) {
                metrics.recordValidationFailure(draft.getSourceType().name());
                log.warn("Draft failed re-validation: entryNumber={}, violations={}",
                        draft.getEntryNumber(), validation.getViolations());
                throw new LedgerValidationException(validation);
            }
            periods.assertOpenForPosting(draft.getEntryDate());

            store.markPosted(posted);
            balanceMaterializer.applyLines(posted.getLines(), accounts);
            outboxService.saveEvent(AGGREGATE_TYPE, entryId,
                    JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.fromEntry(posted));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryPosted(posted.getSourceType().name());
            metrics.recordLatency("post", "success", duration);

            log.info("Journal entry posted: entryNumber={}, duration={}ms", posted.getEntryNumber(), duration);
            return JournalEntryResult.from(posted, tolerance, false);

        } catch (LedgerException e) {
            recordFailure("post", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Reverses a POSTED entry as of today.
     *
     * @see #reverseEntry(UUID, String, String, LocalDate)
     */
    @Transactional
    public JournalEntryResult reverseEntry(UUID entryId, String reason, String actor) {
        return reverseEntry(entryId, reason, actor, null);
    }

    /**
     * Cancels a POSTED entry with a new, already-posted entry whose lines swap
     * debit and credit. The original keeps its lines and becomes REVERSED.
     *
     * The reversal is dated {@code reversalDate}, or today when null, and
     * never earlier than the original, so balances already reported as of
     * earlier dates stay as they were. Its period must be open.
     *
     * Reversing frees the original's source, so the source record can be
     * posted again afterwards.
     *
     * @return the reversal entry
     * @throws JournalEntryNotFoundException if no entry has this id
     * @throws LedgerStateException if the entry is a draft or already reversed
     * @throws LedgerValidationException if the reversal date precedes the original or its period is closed
     */
    @Transactional
    public JournalEntryResult reverseEntry(UUID entryId, String reason, String actor, LocalDate reversalDate) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());

        log.info("Reversing journal entry: actor={}, reason={}", actor, reason);

        try {
            locks.applyLockTimeout();

            JournalEntry original = store.findByIdForUpdate(entryId)
                .orElseThrow(() -> new JournalEntryNotFoundException(entryId));

            Instant now = Instant.now();
            UUID reversalId = UUID.randomUUID();
            JournalEntry reversedOriginal = original.markReversed(reversalId, actor, reason, now);

            LocalDate reversalEntryDate = reversalDate != null ? reversalDate : LocalDate.now();
            if (reversalEntryDate.isBefore(original.getEntryDate())) {
                throw new LedgerValidationException(String.format(
                    "reversal date %s is before the entry date %s of %s",
                    reversalEntryDate, original.getEntryDate(), original.getEntryNumber()));
            }

            List<JournalLineRequest> swappedLines = original.getLines().stream()
                .map(l -> new JournalLineRequest(l.getAccountId(), l.getDescription(), l.getCreditAmount(), l.getDebitAmount()))
                .toList();
            String description = reason == null || reason.isBlank()
                ? "Reversal of " + original.getEntryNumber()
                : "Reversal of " + original.getEntryNumber() + ": " + reason;

            JournalEntryRequest reversalRequest = JournalEntryRequest.builder()
                .entryDate(reversalEntryDate)
                .description(description)
                .reference(REVERSAL_REFERENCE_PREFIX + original.getEntryNumber())
                .sourceType(SourceType.REVERSAL)
                .lines(swappedLines)
                .autoPost(true)
                .createdBy(actor)
                .build();

            Map<UUID, Account> accounts = accountCatalog.findAllByIds(accountIds(swappedLines));
            ValidationResult validation = validator.validate(reversalRequest, accounts);
            if (!validation.isValid()) {
                metrics.recordValidationFailure(SourceType.REVERSAL.name());
                throw new LedgerValidationException(validation);
            }
            periods.assertOpenForPosting(reversalEntryDate);

            String reversalNumber = sequenceGenerator.nextEntryNumber(SourceType.REVERSAL);
            JournalEntry reversal = new JournalEntry(
                reversalId,
                reversalNumber,
                SourceType.REVERSAL,
                null,
                reversalRequest.getReference(),
                reversalRequest.getEntryDate(),
                reversalRequest.getDescription(),
                JournalStatus.POSTED,
                validation.getTotalDebit(),
                validation.getTotalCredit(),
                actor,
                now,
                now,
                original.getId(),
                null, null, null, null,
                toLines(reversalId, swappedLines)
            );

            insert(reversal);
            store.markReversed(reversedOriginal);
            balanceMaterializer.applyLines(reversal.getLines(), accounts);

            outboxService.saveEvent(AGGREGATE_TYPE, reversalId,
                    JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.fromEntry(reversal));
            outboxService.saveEvent(AGGREGATE_TYPE, original.getId(),
                    JournalEntryReversedEvent.EVENT_TYPE, JournalEntryReversedEvent.of(reversedOriginal, reversal));

            if (original.getSourceId() != null) {
                idempotencyService.forgetAfterCommit(original.getSourceType(), original.getSourceId());
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEntryReversed();
            metrics.recordEntryCreated(SourceType.REVERSAL.name(), JournalStatus.POSTED.name());
            metrics.recordLatency("reverse", "success", duration);

            log.info("Journal entry reversed: original={}, reversal={}, duration={}ms",
                    original.getEntryNumber(), reversalNumber, duration);

            return JournalEntryResult.from(reversal, tolerance, false);

        } catch (LedgerException e) {
            recordFailure("reverse", e, startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public JournalEntryResult getEntry(UUID entryId) {
        return store.findById(entryId)
            .map(entry -> JournalEntryResult.from(entry, tolerance, false))
            .orElseThrow(() -> new JournalEntryNotFoundException(entryId));
    }

    /**
     * The live entry already representing a source record, as a replay result.
     */
    @Transactional(readOnly = true)
    public Optional<JournalEntryResult> findLiveEntry(SourceType sourceType, long sourceId) {
        return idempotencyService.findLiveEntry(sourceType, sourceId).map(this::replay);
    }

    private Optional<JournalEntryResult> replayFromCache(JournalEntryRequest request) {
        return idempotencyService.findCachedEntryId(request.getSourceType(), request.getSourceId())
            .flatMap(store::findById)
            .filter(entry -> entry.getStatus() != JournalStatus.REVERSED)
            .map(this::replay);
    }

    private JournalEntryResult replay(JournalEntry existing) {
        metrics.recordIdempotencyHit();
        log.info("Source already journaled, returning existing entry: source={}:{}, entryNumber={}",
                existing.getSourceType(), existing.getSourceId(), existing.getEntryNumber());
        return JournalEntryResult.from(existing, tolerance, true);
    }

    private void insert(JournalEntry entry) {
        try {
            store.insert(entry);
        } catch (DuplicateKeyException e) {
            if (e.getMessage() == null || !e.getMessage().contains(ACTIVE_SOURCE_INDEX)) {
                throw e;
            }
            throw new LedgerStateException(LedgerStateException.Reason.DUPLICATE_SOURCE, entry.getId(), null,
                String.format("A live journal entry already exists for %s:%s",
                    entry.getSourceType(), entry.getSourceId()));
        }
    }

    private void recordFailure(String operation, LedgerException e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        if (e instanceof LedgerConcurrencyException) {
            metrics.recordContention(e.getErrorCode());
        }
        metrics.recordLatency(operation, e.getErrorCode(), duration);
        log.warn("Journal {} failed: code={}, error={}, duration={}ms",
                operation, e.getErrorCode(), e.getMessage(), duration);
    }

    private static List<JournalLine> toLines(UUID entryId, List<JournalLineRequest> requests) {
        List<JournalLine> lines = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            JournalLineRequest r = requests.get(i);
            lines.add(new JournalLine(UUID.randomUUID(), entryId, i + 1, r.getAccountId(),
                r.getDescription(), r.getDebitAmount(), r.getCreditAmount()));
        }
        return List.copyOf(lines);
    }

    private static Set<UUID> accountIds(List<JournalLineRequest> lines) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (JournalLineRequest line : lines) {
            if (line != null && line.getAccountId() != null) {
                ids.add(line.getAccountId());
            }
        }
        return ids;
    }
}
