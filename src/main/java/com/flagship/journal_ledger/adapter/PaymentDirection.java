package com.flagship.journal_ledger.adapter;

public enum PaymentDirection {
    /** Money in from a customer, settling receivables. */
    CUSTOMER_RECEIPT,
    /** Money out to a vendor, settling payables. */
    VENDOR_PAYMENT
}
