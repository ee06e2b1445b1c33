package com.flagship.journal_ledger.adapter;

/**
 * Account codes the source adapters post to. Seeded by the V4 migration.
 */
public final class ChartOfAccountsCodes {

    public static final String CASH = "1101";
    public static final String BANK = "1102";
    public static final String ACCOUNTS_RECEIVABLE = "1201";
    public static final String VAT_INPUT = "1240";
    public static final String INVENTORY = "1301";
    public static final String ACCOUNTS_PAYABLE = "2101";
    public static final String VAT_OUTPUT = "2103";
    public static final String PPH21_PAYABLE = "2111";
    public static final String PPH23_PAYABLE = "2112";
    public static final String SALES_REVENUE = "4101";
    public static final String COST_OF_GOODS_SOLD = "5101";

    private ChartOfAccountsCodes() {
    }
}
