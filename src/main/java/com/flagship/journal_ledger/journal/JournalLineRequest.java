package com.flagship.journal_ledger.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A requested journal line. Exactly one of debit or credit must be positive.
 */
@Value
@Builder
public class JournalLineRequest {
    UUID accountId;
    String description;
    BigDecimal debitAmount;
    BigDecimal creditAmount;

    @JsonCreator
    public JournalLineRequest(@JsonProperty("accountId") UUID accountId,
                              @JsonProperty("description") String description,
                              @JsonProperty("debitAmount") BigDecimal debitAmount,
                              @JsonProperty("creditAmount") BigDecimal creditAmount) {
        this.accountId = accountId;
        this.description = description;
        this.debitAmount = debitAmount != null ? debitAmount : BigDecimal.ZERO;
        this.creditAmount = creditAmount != null ? creditAmount : BigDecimal.ZERO;
    }

    public static JournalLineRequest debit(UUID accountId, BigDecimal amount, String description) {
        return new JournalLineRequest(accountId, description, amount, BigDecimal.ZERO);
    }

    public static JournalLineRequest credit(UUID accountId, BigDecimal amount, String description) {
        return new JournalLineRequest(accountId, description, BigDecimal.ZERO, amount);
    }
}
