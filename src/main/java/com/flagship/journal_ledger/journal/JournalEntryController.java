package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.config.LedgerRetryTemplate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST endpoints for the journal entry lifecycle.
 *
 * Each call is retried on lock contention; the engine's source check makes a
 * retried sourced create return the entry of the attempt that won.
 */
@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    private final JournalPostingEngine engine;
    private final LedgerRetryTemplate retryTemplate;

    /**
     * Creates an entry. Returns 201 for a new entry and 200 when the source
     * was already journaled and the existing entry is returned.
     */
    @PostMapping
    public ResponseEntity<JournalEntryResult> createEntry(@RequestBody JournalEntryRequest request) {
        log.info("Received journal entry request: sourceType={}, sourceId={}, autoPost={}",
                request.getSourceType(), request.getSourceId(), request.isAutoPost());

        JournalEntryResult result = retryTemplate.execute("create", () -> engine.createEntry(request));

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/{id}/post")
    public ResponseEntity<JournalEntryResult> postEntry(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(retryTemplate.execute("post", () -> engine.postEntry(id)));
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<JournalEntryResult> reverseEntry(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody ReverseEntryRequest request) {
        JournalEntryResult reversal = retryTemplate.execute("reverse",
            () -> engine.reverseEntry(id, request.getReason(), request.getReversedBy(), request.getReversalDate()));
        return ResponseEntity.status(HttpStatus.CREATED).body(reversal);
    }

    @GetMapping("/{id}")
    public ResponseEntity<JournalEntryResult> getEntry(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(engine.getEntry(id));
    }
}
