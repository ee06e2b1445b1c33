package com.flagship.journal_ledger.period;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodActionRequest {

    @NotBlank(message = "Actor is required")
    @Size(max = 100, message = "Actor must be at most 100 characters")
    private String performedBy;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    private String notes;
}
