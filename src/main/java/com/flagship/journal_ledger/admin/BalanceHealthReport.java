package com.flagship.journal_ledger.admin;

import com.flagship.journal_ledger.journal.BalanceRecomputation;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one reconciliation pass over all postable accounts.
 */
@Value
public class BalanceHealthReport {
    Instant checkedAt;
    int accountsChecked;
    List<BalanceRecomputation> drifted;
    /** Accounts whose check failed, usually on lock timeout; they are picked up by the next pass. */
    List<UUID> failed;
    boolean healing;

    public boolean isHealthy() {
        return drifted.stream().allMatch(BalanceRecomputation::isHealed) && failed.isEmpty();
    }
}
