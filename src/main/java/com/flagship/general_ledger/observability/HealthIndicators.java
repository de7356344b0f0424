package com.flagship.general_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the general ledger.
 */
public class HealthIndicators {

    /**
     * Checks that the ledger tables are reachable and reports entries whose
     * lines do not net to zero. Such entries can only appear through direct
     * database writes, so any of them marks the ledger DOWN.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final JdbcTemplate jdbcTemplate;

        public LedgerHealthIndicator(JdbcTemplate jdbcTemplate) {
            this.jdbcTemplate = jdbcTemplate;
        }

        @Override
        public Health health() {
            try {
                Long entries = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM journal_entries", Long.class);
                Long unbalanced = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM (" +
                    "  SELECT tenant_id, journal_entry_id, settlement_currency FROM journal_lines " +
                    "  GROUP BY tenant_id, journal_entry_id, settlement_currency " +
                    "  HAVING SUM(CASE WHEN side = 'DEBIT' THEN settlement_amount ELSE -settlement_amount END) <> 0" +
                    ") t",
                    Long.class);

                Health.Builder builder = unbalanced == null || unbalanced == 0 ? Health.up() : Health.down();
                return builder
                        .withDetail("journalEntries", entries != null ? entries : 0L)
                        .withDetail("unbalancedEntries", unbalanced != null ? unbalanced : 0L)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
