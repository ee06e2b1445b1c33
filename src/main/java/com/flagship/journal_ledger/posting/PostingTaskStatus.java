package com.flagship.journal_ledger.posting;

public enum PostingTaskStatus {
    PENDING,
    COMPLETED,
    DEAD_LETTER
}
