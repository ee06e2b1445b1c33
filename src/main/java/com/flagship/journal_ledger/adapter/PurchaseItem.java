package com.flagship.journal_ledger.adapter;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A purchased line. Without an expense account the amount goes to inventory.
 */
@Value
@Builder
public class PurchaseItem {
    String description;
    BigDecimal amount;
    String expenseAccountCode;
}
