package com.flagship.journal_ledger.exception;

import com.flagship.journal_ledger.journal.JournalStatus;

import java.util.UUID;

/**
 * A state transition was requested that the entry's lifecycle does not allow.
 */
public class LedgerStateException extends LedgerException {

    public enum Reason {
        ALREADY_POSTED,
        ALREADY_REVERSED,
        NOT_POSTED,
        DUPLICATE_SOURCE
    }

    private final Reason reason;
    private final UUID entryId;
    private final JournalStatus currentStatus;

    public LedgerStateException(Reason reason, UUID entryId, JournalStatus currentStatus, String message) {
        super(message);
        this.reason = reason;
        this.entryId = entryId;
        this.currentStatus = currentStatus;
    }

    public Reason getReason() {
        return reason;
    }

    public UUID getEntryId() {
        return entryId;
    }

    public JournalStatus getCurrentStatus() {
        return currentStatus;
    }

    @Override
    public String getErrorCode() {
        return reason.name();
    }
}
