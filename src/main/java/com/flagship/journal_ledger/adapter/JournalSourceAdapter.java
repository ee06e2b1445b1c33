package com.flagship.journal_ledger.adapter;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.account.AccountLookupCache;
import com.flagship.journal_ledger.exception.ChartOfAccountsIntegrityException;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.JournalLineRequest;
import com.flagship.journal_ledger.journal.JournalPostingEngine;
import com.flagship.journal_ledger.journal.SourceType;
import com.flagship.journal_ledger.posting.JournalPostingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a domain document (sale, purchase, payment) into a balanced, auto-posted journal entry.
 *
 * Subclasses only decide which accounts are debited and credited. Posting
 * runs inside the caller's transaction, so the document and its journal
 * entry commit together, and it is safe to repeat: a document that was
 * already journaled returns its existing entry.
 *
 * @param <T> the domain document type
 */
@Slf4j
public abstract class JournalSourceAdapter<T> {

    protected final JournalPostingEngine engine;
    protected final AccountLookupCache accountLookup;
    protected final JournalPostingQueue postingQueue;

    protected JournalSourceAdapter(JournalPostingEngine engine,
                                   AccountLookupCache accountLookup,
                                   JournalPostingQueue postingQueue) {
        this.engine = engine;
        this.accountLookup = accountLookup;
        this.postingQueue = postingQueue;
    }

    protected abstract SourceType sourceType();

    protected abstract long sourceId(T document);

    /**
     * Entry header fields: date, description, reference and author.
     */
    protected abstract JournalEntryRequest.JournalEntryRequestBuilder header(T document);

    /**
     * The balanced line set for the document.
     *
     * @throws ChartOfAccountsIntegrityException if a required account is missing or not postable
     */
    public abstract List<JournalLineRequest> buildJournalLines(T document);

    /**
     * Documents in a non-final state are skipped rather than rejected.
     */
    protected boolean isPostable(T document) {
        return true;
    }

    /**
     * Posts the document's journal entry in the caller's transaction.
     *
     * A document that already has a live entry gets that entry back before any
     * account is resolved, so later chart changes do not break a repeated call.
     *
     * @return the entry, or empty when the document is not in a postable state
     */
    @Transactional
    public Optional<JournalEntryResult> post(T document) {
        if (!isPostable(document)) {
            log.info("Skipping journal posting for {} #{}: document not in a postable state",
                    sourceType(), sourceId(document));
            return Optional.empty();
        }
        Optional<JournalEntryResult> existing = engine.findLiveEntry(sourceType(), sourceId(document));
        if (existing.isPresent()) {
            log.debug("{} #{} already journaled as {}", sourceType(), sourceId(document),
                    existing.get().getEntryNumber());
            return existing;
        }
        return Optional.of(engine.createEntry(toRequest(document)));
    }

    /**
     * Defers posting to the posting queue. The lines are built now, so a broken
     * chart of accounts still fails the caller's transaction.
     *
     * @return the queued task id, or empty when the document is not in a postable
     *         state or already has a live entry
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<UUID> enqueue(T document) {
        if (!isPostable(document) || engine.findLiveEntry(sourceType(), sourceId(document)).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(postingQueue.enqueue(toRequest(document)));
    }

    public JournalEntryRequest toRequest(T document) {
        return header(document)
            .sourceType(sourceType())
            .sourceId(sourceId(document))
            .lines(buildJournalLines(document))
            .autoPost(true)
            .build();
    }

    /**
     * Resolves a fixed chart-of-accounts code.
     */
    protected Account requireAccount(String code) {
        Account account = accountLookup.findByCode(code)
            .orElseThrow(() -> new ChartOfAccountsIntegrityException(code,
                String.format("%s posting requires account %s, which does not exist", sourceType(), code)));
        if (!account.isPostable()) {
            throw new ChartOfAccountsIntegrityException(code,
                String.format("%s posting requires account %s, which is %s", sourceType(), code,
                    account.isHeader() ? "a header account" : "inactive"));
        }
        return account;
    }

    /**
     * Resolves an optional per-document override, falling back to the default code.
     */
    protected Account requireAccount(String overrideCode, String defaultCode) {
        return requireAccount(overrideCode != null && !overrideCode.isBlank() ? overrideCode : defaultCode);
    }
}
