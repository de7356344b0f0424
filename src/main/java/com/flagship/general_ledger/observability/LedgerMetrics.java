package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.exception.ErrorCode;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.period.PeriodStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.entries.posted: Counter of posted entries, tagged by entry kind
 * - ledger.entries.reversed: Counter of reversals
 * - ledger.postings.rejected: Counter of rejected commands, tagged by error code
 * - ledger.posting.latency: Timer per operation (post, reverse, transition)
 * - ledger.integrity.drifts: Counter of balance drifts found by integrity checks
 * - ledger.accounts.created, ledger.periods.transitioned
 *
 * Tenant ids are never used as tags.
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter entriesReversed;
    private final Counter accountsCreated;
    private final Counter integrityDrifts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesReversed = Counter.builder("ledger.entries.reversed")
                .description("Number of journal entries reversed")
                .register(registry);

        this.accountsCreated = Counter.builder("ledger.accounts.created")
                .description("Number of accounts created")
                .register(registry);

        this.integrityDrifts = Counter.builder("ledger.integrity.drifts")
                .description("Balance drifts found by integrity checks")
                .register(registry);
    }

    public void recordEntryPosted(EntryKind kind) {
        registry.counter("ledger.entries.posted", "kind", kind.name()).increment();
    }

    public void incrementEntriesReversed() {
        entriesReversed.increment();
    }

    public void recordRejection(ErrorCode errorCode) {
        registry.counter("ledger.postings.rejected",
                "error_code", sanitizeTag(errorCode != null ? errorCode.name() : null)
        ).increment();
    }

    public void incrementAccountsCreated() {
        accountsCreated.increment();
    }

    public void recordPeriodTransition(PeriodStatus status) {
        registry.counter("ledger.periods.transitioned", "status", status.name()).increment();
    }

    public void recordIntegrityDrifts(int driftCount) {
        if (driftCount > 0) {
            integrityDrifts.increment(driftCount);
        }
    }

    /**
     * Records operation latency. Uses registry.timer() for meter lookup/creation.
     */
    public void recordLatency(String operation, long durationMs) {
        Timer timer = registry.timer("ledger.posting.latency", "operation", sanitizeTag(operation));
        timer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
