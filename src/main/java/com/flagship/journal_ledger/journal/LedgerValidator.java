package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.account.Account;
import com.flagship.journal_ledger.config.LedgerProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks a requested entry against the double-entry rules.
 *
 * Pure function of its inputs: accounts are resolved by the caller and
 * nothing is read or written here. All violations are collected so the caller
 * gets the full list in one round trip.
 */
@Component
public class LedgerValidator {

    static final int MIN_LINES = 2;
    static final int MAX_SCALE = 2;

    private final BigDecimal tolerance;

    public LedgerValidator(LedgerProperties properties) {
        this(properties.getBalanceTolerance());
    }

    LedgerValidator(BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    public ValidationResult validate(JournalEntryRequest request, Map<UUID, Account> accountsById) {
        List<String> violations = new ArrayList<>();
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;

        if (request.getEntryDate() == null) {
            violations.add("entry date is required");
        }
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            violations.add("description is required");
        }

        List<JournalLineRequest> lines = request.getLines();
        if (lines.isEmpty()) {
            violations.add("entry has no lines");
            return new ValidationResult(List.copyOf(violations), totalDebit, totalCredit);
        }
        if (lines.size() < MIN_LINES) {
            violations.add("entry must have at least " + MIN_LINES + " lines");
        }

        for (int i = 0; i < lines.size(); i++) {
            JournalLineRequest line = lines.get(i);
            String at = "line " + (i + 1) + ": ";
            if (line == null) {
                violations.add(at + "is empty");
                continue;
            }

            checkAccount(line.getAccountId(), accountsById, at, violations);

            BigDecimal debit = line.getDebitAmount();
            BigDecimal credit = line.getCreditAmount();

            if (debit.signum() < 0 || credit.signum() < 0) {
                violations.add(at + "amounts cannot be negative");
                continue;
            }
            if (debit.signum() > 0 && credit.signum() > 0) {
                violations.add(at + "cannot carry both a debit and a credit");
            } else if (debit.signum() == 0 && credit.signum() == 0) {
                violations.add(at + "must carry a debit or a credit");
            }
            if (debit.stripTrailingZeros().scale() > MAX_SCALE || credit.stripTrailingZeros().scale() > MAX_SCALE) {
                violations.add(at + "amounts cannot have more than " + MAX_SCALE + " decimal places");
            }

            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);
        }

        if (totalDebit.subtract(totalCredit).abs().compareTo(tolerance) > 0) {
            violations.add(String.format("entry is unbalanced: debits=%s, credits=%s",
                totalDebit.toPlainString(), totalCredit.toPlainString()));
        }

        return new ValidationResult(List.copyOf(violations), totalDebit, totalCredit);
    }

    private void checkAccount(UUID accountId, Map<UUID, Account> accountsById, String at, List<String> violations) {
        if (accountId == null) {
            violations.add(at + "account is required");
            return;
        }
        Account account = accountsById.get(accountId);
        if (account == null) {
            violations.add(at + "account " + accountId + " does not exist");
        } else if (!account.isActive()) {
            violations.add(at + "account " + account.getCode() + " is inactive");
        } else if (account.isHeader()) {
            violations.add(at + "account " + account.getCode() + " is a header account");
        }
    }
}
