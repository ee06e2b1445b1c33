package com.flagship.journal_ledger.period;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Month-end controls. Periods are addressed as {@code yyyy-MM}.
 */
@RestController
@RequestMapping("/api/periods")
@RequiredArgsConstructor
public class AccountingPeriodController {

    private final AccountingPeriodService periodService;

    @GetMapping
    public ResponseEntity<List<AccountingPeriod>> listPeriods() {
        return ResponseEntity.ok(periodService.findAll());
    }

    /**
     * Months never closed are reported as open.
     */
    @GetMapping("/{month}")
    public ResponseEntity<AccountingPeriod> getPeriod(@PathVariable("month") String month) {
        YearMonth parsed = parse(month);
        return ResponseEntity.ok(periodService.find(parsed).orElseGet(() -> AccountingPeriod.open(parsed)));
    }

    @PostMapping("/{month}/close")
    public ResponseEntity<AccountingPeriod> close(@PathVariable("month") String month,
                                                  @Valid @RequestBody PeriodActionRequest request) {
        return ResponseEntity.ok(periodService.close(parse(month), request.getPerformedBy(), request.getNotes()));
    }

    @PostMapping("/{month}/reopen")
    public ResponseEntity<AccountingPeriod> reopen(@PathVariable("month") String month,
                                                   @Valid @RequestBody PeriodActionRequest request) {
        return ResponseEntity.ok(periodService.reopen(parse(month), request.getPerformedBy(), request.getNotes()));
    }

    @PostMapping("/{month}/lock")
    public ResponseEntity<AccountingPeriod> lock(@PathVariable("month") String month,
                                                 @Valid @RequestBody PeriodActionRequest request) {
        return ResponseEntity.ok(periodService.lock(parse(month), request.getPerformedBy()));
    }

    private static YearMonth parse(String month) {
        try {
            return YearMonth.parse(month);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Period must be formatted yyyy-MM: " + month);
        }
    }
}
