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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Journals vendor purchases.
 *
 * <pre>
 *   Dr Inventory or item expense account   item amount (per item)
 *   Dr VAT Input                           input tax
 *     Cr Cash / Bank / Accounts Payable    items + input tax - withholdings
 *     Cr PPh 21 Payable                    pph21
 *     Cr PPh 23 Payable                    pph23
 * </pre>
 */
@Component
public class PurchaseJournalAdapter extends JournalSourceAdapter<Purchase> {

    public PurchaseJournalAdapter(JournalPostingEngine engine,
                                  AccountLookupCache accountLookup,
                                  JournalPostingQueue postingQueue) {
        super(engine, accountLookup, postingQueue);
    }

    @Override
    protected SourceType sourceType() {
        return SourceType.PURCHASE;
    }

    @Override
    protected long sourceId(Purchase purchase) {
        return purchase.getId();
    }

    @Override
    protected JournalEntryRequest.JournalEntryRequestBuilder header(Purchase purchase) {
        String vendor = purchase.getVendorName() != null ? " - " + purchase.getVendorName() : "";
        return JournalEntryRequest.builder()
            .entryDate(purchase.getDate())
            .description("Purchase " + purchase.getCode() + vendor)
            .reference(purchase.getCode())
            .createdBy(purchase.getCreatedBy());
    }

    @Override
    public List<JournalLineRequest> buildJournalLines(Purchase purchase) {
        String code = purchase.getCode();
        List<JournalLineRequest> lines = new ArrayList<>();

        BigDecimal itemsTotal = BigDecimal.ZERO;
        for (PurchaseItem item : purchase.getItems()) {
            BigDecimal amount = nonNull(item.getAmount());
            if (amount.signum() <= 0) {
                continue;
            }
            UUID debitAccount = requireAccount(item.getExpenseAccountCode(), ChartOfAccountsCodes.INVENTORY).getId();
            String description = item.getDescription() != null ? item.getDescription() : "Purchase " + code;
            lines.add(JournalLineRequest.debit(debitAccount, amount, description));
            itemsTotal = itemsTotal.add(amount);
        }
        if (itemsTotal.signum() <= 0) {
            throw new LedgerValidationException("Purchase " + code + " has no positive item amounts");
        }

        BigDecimal inputTax = nonNull(purchase.getInputTax());
        BigDecimal pph21 = nonNull(purchase.getPph21());
        BigDecimal pph23 = nonNull(purchase.getPph23());

        if (inputTax.signum() > 0) {
            lines.add(JournalLineRequest.debit(requireAccount(ChartOfAccountsCodes.VAT_INPUT).getId(),
                inputTax, "VAT input " + code));
        }

        BigDecimal netPayable = itemsTotal.add(inputTax).subtract(pph21).subtract(pph23);
        if (netPayable.signum() <= 0) {
            throw new LedgerValidationException(String.format(
                "Purchase %s withholdings (%s) leave nothing payable to the vendor", code, pph21.add(pph23)));
        }
        lines.add(JournalLineRequest.credit(settlementAccount(purchase), netPayable, "Payable " + code));

        if (pph21.signum() > 0) {
            lines.add(JournalLineRequest.credit(requireAccount(ChartOfAccountsCodes.PPH21_PAYABLE).getId(),
                pph21, "PPh 21 withheld " + code));
        }
        if (pph23.signum() > 0) {
            lines.add(JournalLineRequest.credit(requireAccount(ChartOfAccountsCodes.PPH23_PAYABLE).getId(),
                pph23, "PPh 23 withheld " + code));
        }
        return lines;
    }

    private UUID settlementAccount(Purchase purchase) {
        PurchasePaymentMethod method = purchase.getMethod() != null ? purchase.getMethod() : PurchasePaymentMethod.CREDIT;
        return switch (method) {
            case CASH -> requireAccount(purchase.getCashBankAccountCode(), ChartOfAccountsCodes.CASH).getId();
            case TRANSFER, CHECK -> requireAccount(purchase.getCashBankAccountCode(), ChartOfAccountsCodes.BANK).getId();
            case CREDIT -> requireAccount(ChartOfAccountsCodes.ACCOUNTS_PAYABLE).getId();
        };
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
