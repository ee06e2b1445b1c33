package com.flagship.journal_ledger.report;

import com.flagship.journal_ledger.journal.JournalEntryResult;
import com.flagship.journal_ledger.journal.SourceType;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerReportController {

    private final LedgerQueryService queryService;

    /**
     * Balances of all accounts; {@code asOf} defaults to today.
     */
    @GetMapping("/balances")
    public ResponseEntity<AccountBalancesReport> getBalances(
            @RequestParam(value = "asOf", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return ResponseEntity.ok(queryService.getAccountBalances(asOf));
    }

    @GetMapping("/entries")
    public ResponseEntity<List<JournalEntryResult>> getEntriesBySource(
            @RequestParam("sourceType") SourceType sourceType,
            @RequestParam("sourceId") long sourceId,
            @RequestParam(value = "includeDrafts", defaultValue = "false") boolean includeDrafts) {
        return ResponseEntity.ok(queryService.getEntriesBySource(sourceType, sourceId, includeDrafts));
    }

    @GetMapping("/accounts/{id}")
    public ResponseEntity<AccountLedger> getLedgerForAccount(
            @PathVariable("id") UUID accountId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "includeDrafts", defaultValue = "false") boolean includeDrafts) {
        return ResponseEntity.ok(queryService.getLedgerForAccount(accountId, from, to, includeDrafts));
    }
}
