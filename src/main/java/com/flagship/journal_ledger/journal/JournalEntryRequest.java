package com.flagship.journal_ledger.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input to {@link JournalPostingEngine#createEntry(JournalEntryRequest)}.
 *
 * When {@code sourceId} is set, at most one live entry may exist for the
 * {@code (sourceType, sourceId)} pair; a repeated submission returns the
 * existing entry instead of creating a second one.
 *
 * Null lines are kept so the validator can report them by position.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntryRequest {
    LocalDate entryDate;
    String description;
    String reference;
    SourceType sourceType;
    Long sourceId;
    List<JournalLineRequest> lines;
    boolean autoPost;
    String createdBy;

    @JsonCreator
    public JournalEntryRequest(@JsonProperty("entryDate") LocalDate entryDate,
                               @JsonProperty("description") String description,
                               @JsonProperty("reference") String reference,
                               @JsonProperty("sourceType") SourceType sourceType,
                               @JsonProperty("sourceId") Long sourceId,
                               @JsonProperty("lines") List<JournalLineRequest> lines,
                               @JsonProperty("autoPost") boolean autoPost,
                               @JsonProperty("createdBy") String createdBy) {
        this.entryDate = entryDate;
        this.description = description;
        this.reference = reference;
        this.sourceType = sourceType != null ? sourceType : SourceType.MANUAL;
        this.sourceId = sourceId;
        this.lines = lines != null ? Collections.unmodifiableList(new ArrayList<>(lines)) : List.of();
        this.autoPost = autoPost;
        this.createdBy = createdBy;
    }

    public boolean hasSource() {
        return sourceId != null;
    }
}
