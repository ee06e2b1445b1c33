package com.flagship.journal_ledger.adapter;

/**
 * How a sale or payment is settled.
 */
public enum SettlementMethod {
    CASH,
    BANK,
    CREDIT
}
