package com.flagship.journal_ledger.journal;

/**
 * Lifecycle of a journal entry: DRAFT, then POSTED, then REVERSED (terminal).
 */
public enum JournalStatus {
    DRAFT,
    POSTED,
    REVERSED;

    /**
     * Whether the entry's lines count toward account balances.
     * A reversed entry still counts; its effect is cancelled by the reversal entry.
     */
    public boolean affectsBalances() {
        return this != DRAFT;
    }
}
