package com.flagship.journal_ledger.journal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReverseEntryRequest {

    @NotBlank(message = "Reversal reason is required")
    @Size(max = 500, message = "Reversal reason must be at most 500 characters")
    private String reason;

    private String reversedBy;

    /**
     * Defaults to the day of the request.
     */
    private LocalDate reversalDate;
}
