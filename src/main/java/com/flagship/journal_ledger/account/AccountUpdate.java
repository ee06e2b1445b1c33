package com.flagship.journal_ledger.account;

import lombok.Builder;
import lombok.Value;

/**
 * Typed partial update of an account. Null fields are left unchanged.
 * Code, type and balance cannot be changed through the catalog.
 */
@Value
@Builder
public class AccountUpdate {
    String name;
    Boolean active;

    public boolean isEmpty() {
        return name == null && active == null;
    }
}
