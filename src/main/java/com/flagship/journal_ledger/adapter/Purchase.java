package com.flagship.journal_ledger.adapter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A vendor purchase with optional input VAT and income tax withholdings.
 */
@Value
@Builder
public class Purchase {
    long id;
    String code;
    LocalDate date;
    String vendorName;
    PurchasePaymentMethod method;
    String cashBankAccountCode;
    @Singular
    List<PurchaseItem> items;
    BigDecimal inputTax;
    /** PPh 21 withheld from the vendor. */
    BigDecimal pph21;
    /** PPh 23 withheld from the vendor. */
    BigDecimal pph23;
    String createdBy;
}
