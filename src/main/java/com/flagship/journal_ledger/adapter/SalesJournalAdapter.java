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
 * Journals invoiced and paid sales.
 *
 * <pre>
 *   Dr Cash / Bank / Accounts Receivable   subtotal + tax
 *     Cr Sales Revenue                     subtotal
 *     Cr VAT Output                        tax
 *   Dr Cost of Goods Sold                  cost
 *     Cr Inventory                         cost
 * </pre>
 */
@Component
public class SalesJournalAdapter extends JournalSourceAdapter<Sale> {

    public SalesJournalAdapter(JournalPostingEngine engine,
                               AccountLookupCache accountLookup,
                               JournalPostingQueue postingQueue) {
        super(engine, accountLookup, postingQueue);
    }

    @Override
    protected SourceType sourceType() {
        return SourceType.SALES;
    }

    @Override
    protected long sourceId(Sale sale) {
        return sale.getId();
    }

    @Override
    protected boolean isPostable(Sale sale) {
        return sale.getStatus() != null && sale.getStatus().isJournaled();
    }

    @Override
    protected JournalEntryRequest.JournalEntryRequestBuilder header(Sale sale) {
        String customer = sale.getCustomerName() != null ? " - " + sale.getCustomerName() : "";
        return JournalEntryRequest.builder()
            .entryDate(sale.getDate())
            .description("Sale " + sale.getInvoiceNumber() + customer)
            .reference(sale.getInvoiceNumber())
            .createdBy(sale.getCreatedBy());
    }

    @Override
    public List<JournalLineRequest> buildJournalLines(Sale sale) {
        BigDecimal subtotal = nonNull(sale.getSubtotal());
        BigDecimal tax = nonNull(sale.getTaxAmount());
        BigDecimal cost = nonNull(sale.getCostOfGoodsSold());
        if (subtotal.signum() <= 0) {
            throw new LedgerValidationException("Sale " + sale.getInvoiceNumber() + " has no positive subtotal");
        }

        String invoice = sale.getInvoiceNumber();
        List<JournalLineRequest> lines = new ArrayList<>();

        lines.add(JournalLineRequest.debit(settlementAccount(sale), subtotal.add(tax), "Sale " + invoice));
        lines.add(JournalLineRequest.credit(requireAccount(ChartOfAccountsCodes.SALES_REVENUE).getId(),
            subtotal, "Sales revenue " + invoice));
        if (tax.signum() > 0) {
            lines.add(JournalLineRequest.credit(requireAccount(ChartOfAccountsCodes.VAT_OUTPUT).getId(),
                tax, "VAT output " + invoice));
        }
        if (cost.signum() > 0) {
            lines.add(JournalLineRequest.debit(requireAccount(ChartOfAccountsCodes.COST_OF_GOODS_SOLD).getId(),
                cost, "Cost of goods sold " + invoice));
            lines.add(JournalLineRequest.credit(requireAccount(ChartOfAccountsCodes.INVENTORY).getId(),
                cost, "Inventory out " + invoice));
        }
        return lines;
    }

    private UUID settlementAccount(Sale sale) {
        SettlementMethod method = sale.getSettlementMethod() != null ? sale.getSettlementMethod() : SettlementMethod.CREDIT;
        return switch (method) {
            case CASH -> requireAccount(sale.getCashBankAccountCode(), ChartOfAccountsCodes.CASH).getId();
            case BANK -> requireAccount(sale.getCashBankAccountCode(), ChartOfAccountsCodes.BANK).getId();
            case CREDIT -> requireAccount(ChartOfAccountsCodes.ACCOUNTS_RECEIVABLE).getId();
        };
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
