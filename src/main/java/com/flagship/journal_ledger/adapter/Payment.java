package com.flagship.journal_ledger.adapter;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class Payment {
    long id;
    String number;
    LocalDate date;
    PaymentDirection direction;
    CashBankMethod method;
    String cashBankAccountCode;
    BigDecimal amount;
    String counterparty;
    String createdBy;
}
