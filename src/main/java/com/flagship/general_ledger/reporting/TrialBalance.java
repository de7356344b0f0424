package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.money.CurrencyCode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Per-account balances of a tenant at a point in time with per-currency
 * totals. Imbalances are reported in {@code findings}; balances are never
 * adjusted to hide them.
 */
@Value
@Builder
public class TrialBalance {
    String tenantId;
    String periodId;
    LocalDate asOfDate;
    BalanceSource source;
    @Singular
    List<TrialBalanceLine> lines;
    List<CurrencyTotals> totals;
    boolean balanced;
    @Singular
    List<String> findings;
    @Singular
    List<String> warnings;
    Instant generatedAt;

    public Optional<TrialBalanceLine> line(String accountCode) {
        return lines.stream().filter(line -> line.getAccountCode().equals(accountCode)).findFirst();
    }

    public Optional<CurrencyTotals> totalsFor(CurrencyCode currency) {
        return totals.stream().filter(total -> total.getCurrency() == currency).findFirst();
    }

    /**
     * SHA-256 over the account lines in code order. Two trial balances with the
     * same balances have the same checksum regardless of when they were built.
     */
    public String checksum() {
        StringBuilder canonical = new StringBuilder();
        for (TrialBalanceLine line : lines) {
            canonical.append(line.getAccountCode())
                .append('|')
                .append(line.getCurrency())
                .append('|')
                .append(line.getBalance().getAmount().toPlainString())
                .append('\n');
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
