package com.flagship.journal_ledger.admin;

import com.flagship.journal_ledger.account.AccountBalanceSnapshot;
import com.flagship.journal_ledger.account.AccountCatalog;
import com.flagship.journal_ledger.journal.BalanceMaterializer;
import com.flagship.journal_ledger.journal.BalanceRecomputation;
import com.flagship.journal_ledger.posting.JournalPostingQueue;
import com.flagship.journal_ledger.posting.JournalPostingTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints: balance drift checks and dead-lettered postings.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class LedgerAdminController {

    private final BalanceReconciliationJob reconciliationJob;
    private final BalanceMaterializer balanceMaterializer;
    private final JournalPostingQueue postingQueue;
    private final AccountCatalog accountCatalog;

    /**
     * Read-only drift scan.
     */
    @GetMapping("/balances/health")
    public ResponseEntity<BalanceHealthReport> balanceHealth() {
        return ResponseEntity.ok(reconciliationJob.runOnce(false));
    }

    @PostMapping("/balances/heal")
    public ResponseEntity<BalanceHealthReport> healBalances() {
        log.info("Manual balance heal requested");
        return ResponseEntity.ok(reconciliationJob.runOnce(true));
    }

    @GetMapping("/balances/{accountId}")
    public ResponseEntity<AccountBalanceSnapshot> balanceSnapshot(@PathVariable("accountId") UUID accountId) {
        return accountCatalog.getBalanceSnapshot(accountId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/balances/{accountId}/recompute")
    public ResponseEntity<BalanceRecomputation> recompute(@PathVariable("accountId") UUID accountId) {
        return ResponseEntity.ok(balanceMaterializer.recompute(accountId));
    }

    @GetMapping("/posting-tasks/dead-letter")
    public ResponseEntity<List<JournalPostingTask>> deadLetters() {
        return ResponseEntity.ok(postingQueue.findDeadLetters());
    }

    @PostMapping("/posting-tasks/{taskId}/requeue")
    public ResponseEntity<JournalPostingTask> requeue(@PathVariable("taskId") UUID taskId) {
        log.info("Requeue requested for posting task {}", taskId);
        return ResponseEntity.ok(postingQueue.requeue(taskId));
    }
}
