package com.flagship.journal_ledger.adapter;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * The parts of a sale the ledger needs. Amounts are net of tax unless noted.
 */
@Value
@Builder
public class Sale {
    long id;
    String invoiceNumber;
    LocalDate date;
    SaleStatus status;
    SettlementMethod settlementMethod;
    /** Cash or bank account to debit instead of the default, for CASH/BANK sales. */
    String cashBankAccountCode;
    String customerName;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal costOfGoodsSold;
    String createdBy;
}
