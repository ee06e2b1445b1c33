package com.flagship.journal_ledger.adapter;

import com.flagship.journal_ledger.account.AccountLookupCache;
import com.flagship.journal_ledger.exception.LedgerValidationException;
import com.flagship.journal_ledger.journal.JournalEntryRequest;
import com.flagship.journal_ledger.journal.JournalLineRequest;
import com.flagship.journal_ledger.journal.JournalPostingEngine;
import com.flagship.journal_ledger.journal.SourceType;
import com.flagship.journal_ledger.posting.JournalPostingQueue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Journals customer receipts and vendor payments.
 *
 * <pre>
 *   receipt:  Dr Cash / Bank          Cr Accounts Receivable
 *   payment:  Dr Accounts Payable     Cr Cash / Bank
 * </pre>
 */
@Component
public class PaymentJournalAdapter extends JournalSourceAdapter<Payment> {

    public PaymentJournalAdapter(JournalPostingEngine engine,
                                 AccountLookupCache accountLookup,
                                 JournalPostingQueue postingQueue) {
        super(engine, accountLookup, postingQueue);
    }

    @Override
    protected SourceType sourceType() {
        return SourceType.PAYMENT;
    }

    @Override
    protected long sourceId(Payment payment) {
        return payment.getId();
    }

    @Override
    protected JournalEntryRequest.JournalEntryRequestBuilder header(Payment payment) {
        String verb = payment.getDirection() == PaymentDirection.VENDOR_PAYMENT ? "Payment to " : "Receipt from ";
        String counterparty = payment.getCounterparty() != null ? payment.getCounterparty() : "unknown";
        return JournalEntryRequest.builder()
            .entryDate(payment.getDate())
            .description(verb + counterparty + " (" + payment.getNumber() + ")")
            .reference(payment.getNumber())
            .createdBy(payment.getCreatedBy());
    }

    @Override
    public List<JournalLineRequest> buildJournalLines(Payment payment) {
        BigDecimal amount = payment.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerValidationException("Payment " + payment.getNumber() + " must have a positive amount");
        }
        if (payment.getDirection() == null) {
            throw new LedgerValidationException("Payment " + payment.getNumber() + " has no direction");
        }

        UUID cashBank = cashBankAccount(payment);
        String number = payment.getNumber();
        return switch (payment.getDirection()) {
            case CUSTOMER_RECEIPT -> List.of(
                JournalLineRequest.debit(cashBank, amount, "Receipt " + number),
                JournalLineRequest.credit(requireAccount(ChartOfAccountsCodes.ACCOUNTS_RECEIVABLE).getId(),
                    amount, "Receivable settled " + number));
            case VENDOR_PAYMENT -> List.of(
                JournalLineRequest.debit(requireAccount(ChartOfAccountsCodes.ACCOUNTS_PAYABLE).getId(),
                    amount, "Payable settled " + number),
                JournalLineRequest.credit(cashBank, amount, "Payment " + number));
        };
    }

    private UUID cashBankAccount(Payment payment) {
        String fallback = payment.getMethod() == CashBankMethod.CASH ? ChartOfAccountsCodes.CASH : ChartOfAccountsCodes.BANK;
        return requireAccount(payment.getCashBankAccountCode(), fallback).getId();
    }
}
