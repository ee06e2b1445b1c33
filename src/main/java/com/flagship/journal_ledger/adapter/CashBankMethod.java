package com.flagship.journal_ledger.adapter;

public enum CashBankMethod {
    CASH,
    BANK
}
