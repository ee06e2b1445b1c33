package com.flagship.journal_ledger.adapter;

public enum PurchasePaymentMethod {
    CASH,
    TRANSFER,
    CHECK,
    CREDIT
}
