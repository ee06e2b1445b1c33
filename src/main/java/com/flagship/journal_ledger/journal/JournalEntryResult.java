package com.flagship.journal_ledger.journal;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * What the engine returns for a created, posted or reversed entry.
 *
 * {@code replayed} is true when the request matched an existing entry for the
 * same source and nothing new was written.
 */
@Value
@Builder
public class JournalEntryResult {
    UUID id;
    String entryNumber;
    JournalStatus status;
    SourceType sourceType;
    Long sourceId;
    String reference;
    LocalDate entryDate;
    String description;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    @JsonProperty("isBalanced")
    boolean balanced;
    boolean replayed;
    UUID reversalOfId;
    UUID reversedById;
    Instant postedAt;
    List<Line> lines;

    public static JournalEntryResult from(JournalEntry entry, BigDecimal tolerance, boolean replayed) {
        return JournalEntryResult.builder()
            .id(entry.getId())
            .entryNumber(entry.getEntryNumber())
            .status(entry.getStatus())
            .sourceType(entry.getSourceType())
            .sourceId(entry.getSourceId())
            .reference(entry.getReference())
            .entryDate(entry.getEntryDate())
            .description(entry.getDescription())
            .totalDebit(entry.getTotalDebit())
            .totalCredit(entry.getTotalCredit())
            .balanced(entry.isBalanced(tolerance))
            .replayed(replayed)
            .reversalOfId(entry.getReversalOfId())
            .reversedById(entry.getReversedById())
            .postedAt(entry.getPostedAt())
            .lines(entry.getLines().stream().map(Line::from).toList())
            .build();
    }

    @Value
    public static class Line {
        int lineNumber;
        UUID accountId;
        String description;
        BigDecimal debitAmount;
        BigDecimal creditAmount;

        static Line from(JournalLine line) {
            return new Line(line.getLineNumber(), line.getAccountId(), line.getDescription(),
                line.getDebitAmount(), line.getCreditAmount());
        }
    }
}
