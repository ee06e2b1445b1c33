package com.flagship.journal_ledger.exception;

import java.util.UUID;

public class JournalEntryNotFoundException extends LedgerException {

    private final UUID entryId;

    public JournalEntryNotFoundException(UUID entryId) {
        super("Journal entry not found: " + entryId);
        this.entryId = entryId;
    }

    public UUID getEntryId() {
        return entryId;
    }

    @Override
    public String getErrorCode() {
        return "ENTRY_NOT_FOUND";
    }
}
