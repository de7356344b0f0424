package com.flagship.general_ledger.store;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountProperties;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.CompanionLinks;
import com.flagship.general_ledger.account.SpecialAccountType;
import com.flagship.general_ledger.exception.ConcurrentPostingException;
import com.flagship.general_ledger.exception.DuplicateAccountException;
import com.flagship.general_ledger.exception.DuplicateEntryException;
import com.flagship.general_ledger.exception.ReversalException;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.EntryType;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link LedgerStore} using JDBC directly.
 *
 * A posting is one transaction: the touched account rows are locked in
 * ascending code order, their balances are compared with the versions the
 * engine validated against, then the entry, its lines, the new balances and
 * the reversal back-link are written. The deferred balance trigger on
 * {@code journal_lines} runs at commit.
 */
@Repository
public class JdbcLedgerStore implements LedgerStore {

    private static final String ACCOUNT_COLUMNS =
        "tenant_id, account_code, account_name, account_type, special_account_type, parent_account_code, " +
        "active, posting_allowed, currency, balance, accumulated_depreciation_code, depreciation_expense_code, " +
        "allowance_account_code, created_at, updated_at, deactivated_at";

    private static final String ENTRY_COLUMNS =
        "tenant_id, journal_entry_id, reference, description, posting_date, accounting_period, entry_kind, " +
        "posted_by, posted_at, reversal_of, reversed_by, reversal_reason";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Account> loadAccount(String tenantId, String accountCode) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE tenant_id = ? AND account_code = ?",
            accountRowMapper(),
            tenantId,
            accountCode
        );
        return accounts.stream().findFirst();
    }

    @Override
    public List<Account> loadAccounts(String tenantId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE tenant_id = ? ORDER BY account_code",
            accountRowMapper(),
            tenantId
        );
    }

    @Override
    @Transactional
    public void insertAccount(Account account) {
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (" + ACCOUNT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                account.getTenantId(),
                account.getAccountCode(),
                account.getAccountName(),
                account.getAccountType().name(),
                account.getSpecialAccountType().name(),
                account.getParentAccountCode(),
                account.isActive(),
                account.isPostingAllowed(),
                account.getCurrency().name(),
                account.getBalance().getAmount(),
                account.getCompanionLinks().getAccumulatedDepreciationCode(),
                account.getCompanionLinks().getDepreciationExpenseCode(),
                account.getCompanionLinks().getAllowanceAccountCode(),
                Timestamp.from(account.getCreatedAt()),
                Timestamp.from(account.getUpdatedAt()),
                toTimestamp(account.getDeactivatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateAccountException(String.format(
                "Account %s already exists for tenant %s", account.getAccountCode(), account.getTenantId()));
        }
    }

    @Override
    @Transactional
    public void saveAccounts(List<Account> accounts) {
        for (Account account : accounts) {
            updateAccountRow(account);
        }
    }

    @Override
    @Transactional
    public void appendJournalEntry(JournalEntry entry) {
        insertEntry(entry);
    }

    @Override
    @Transactional
    public void applyPosting(PostingBatch batch) {
        String tenantId = batch.getTenantId();
        JournalEntry entry = batch.getEntry();

        // Lock rows in code order, then make sure nobody moved them since validation
        Map<String, BigDecimal> lockedBalances = lockBalances(tenantId, batch.getPreviousAccounts());
        for (Account previous : batch.getPreviousAccounts()) {
            BigDecimal stored = lockedBalances.get(previous.getAccountCode());
            if (stored == null || stored.compareTo(previous.getBalance().getAmount()) != 0) {
                throw new ConcurrentPostingException(String.format(
                    "Account %s changed while entry %s was being posted (expected %s, found %s)",
                    previous.getAccountCode(), entry.getJournalEntryId(),
                    previous.getBalance().getAmount().toPlainString(),
                    stored == null ? "no row" : stored.toPlainString()));
            }
        }

        insertEntry(entry);

        for (Account updated : batch.getUpdatedAccounts()) {
            jdbcTemplate.update(
                "UPDATE accounts SET balance = ?, updated_at = ? WHERE tenant_id = ? AND account_code = ?",
                updated.getBalance().getAmount(),
                Timestamp.from(updated.getUpdatedAt()),
                updated.getTenantId(),
                updated.getAccountCode()
            );
        }

        String reversedEntryId = batch.getReversedEntryId();
        if (reversedEntryId != null) {
            int linked = jdbcTemplate.update(
                "UPDATE journal_entries SET reversed_by = ? " +
                "WHERE tenant_id = ? AND journal_entry_id = ? AND reversed_by IS NULL",
                entry.getJournalEntryId(),
                tenantId,
                reversedEntryId
            );
            if (linked == 0) {
                throw new ReversalException(String.format(
                    "Journal entry %s is missing or already reversed", reversedEntryId));
            }
        }
    }

    @Override
    public Optional<JournalEntry> loadJournalEntry(String tenantId, String journalEntryId) {
        List<JournalEntry.JournalEntryBuilder> headers = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE tenant_id = ? AND journal_entry_id = ?",
            entryRowMapper(),
            tenantId,
            journalEntryId
        );
        if (headers.isEmpty()) {
            return Optional.empty();
        }
        List<JournalEntryLine> lines = jdbcTemplate.query(
            "SELECT * FROM journal_lines WHERE tenant_id = ? AND journal_entry_id = ? ORDER BY line_number",
            lineRowMapper(),
            tenantId,
            journalEntryId
        );
        return Optional.of(headers.get(0).lines(lines).build());
    }

    @Override
    public boolean journalEntryExists(String tenantId, String journalEntryId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE tenant_id = ? AND journal_entry_id = ?",
            Integer.class,
            tenantId,
            journalEntryId
        );
        return count != null && count > 0;
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<JournalEntry> loadJournalHistory(String tenantId, LocalDate upToDate) {
        return history(tenantId, upToDate);
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerSnapshot loadSnapshot(String tenantId, LocalDate upToDate) {
        List<Account> accounts = loadAccounts(tenantId);
        return new LedgerSnapshot(tenantId, upToDate, accounts, history(tenantId, upToDate));
    }

    private List<JournalEntry> history(String tenantId, LocalDate upToDate) {
        LocalDate limit = upToDate != null ? upToDate : LocalDate.of(9999, 12, 31);
        Map<String, JournalEntry.JournalEntryBuilder> headers = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries " +
            "WHERE tenant_id = ? AND posting_date <= ? ORDER BY sequence_number",
            rs -> {
                JournalEntry.JournalEntryBuilder header = entryRowMapper().mapRow(rs, 0);
                headers.put(rs.getString("journal_entry_id"), header);
            },
            tenantId,
            Date.valueOf(limit)
        );
        if (headers.isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, List<JournalEntryLine>> linesByEntry = new HashMap<>();
        jdbcTemplate.query(
            "SELECT l.* FROM journal_lines l " +
            "JOIN journal_entries e ON e.tenant_id = l.tenant_id AND e.journal_entry_id = l.journal_entry_id " +
            "WHERE l.tenant_id = ? AND e.posting_date <= ? ORDER BY l.journal_entry_id, l.line_number",
            rs -> {
                linesByEntry.computeIfAbsent(rs.getString("journal_entry_id"), id -> new ArrayList<>())
                    .add(lineRowMapper().mapRow(rs, 0));
            },
            tenantId,
            Date.valueOf(limit)
        );

        List<JournalEntry> entries = new ArrayList<>(headers.size());
        headers.forEach((id, header) ->
            entries.add(header.lines(linesByEntry.getOrDefault(id, List.of())).build()));
        return entries;
    }

    private Map<String, BigDecimal> lockBalances(String tenantId, List<Account> accounts) {
        if (accounts.isEmpty()) {
            return Collections.emptyMap();
        }
        String placeholders = String.join(", ", Collections.nCopies(accounts.size(), "?"));
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        accounts.forEach(account -> args.add(account.getAccountCode()));

        Map<String, BigDecimal> balances = new HashMap<>();
        jdbcTemplate.query(
            "SELECT account_code, balance FROM accounts " +
            "WHERE tenant_id = ? AND account_code IN (" + placeholders + ") " +
            "ORDER BY account_code FOR UPDATE",
            rs -> {
                balances.put(rs.getString("account_code"), rs.getBigDecimal("balance"));
            },
            args.toArray()
        );
        return balances;
    }

    private void insertEntry(JournalEntry entry) {
        try {
            jdbcTemplate.update(
                "INSERT INTO journal_entries (" + ENTRY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getTenantId(),
                entry.getJournalEntryId(),
                entry.getReference(),
                entry.getDescription(),
                Date.valueOf(entry.getPostingDate()),
                entry.getAccountingPeriod(),
                entry.getEntryKind().name(),
                entry.getPostedBy(),
                Timestamp.from(entry.getPostedAt()),
                entry.getReversalOf(),
                entry.getReversedBy(),
                entry.getReversalReason()
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException(entry.getTenantId(), entry.getJournalEntryId());
        }

        int lineNumber = 1;
        for (JournalEntryLine line : entry.getLines()) {
            jdbcTemplate.update(
                "INSERT INTO journal_lines (tenant_id, journal_entry_id, line_number, account_code, side, amount, " +
                "currency, exchange_rate, settlement_amount, settlement_currency, description) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                entry.getTenantId(),
                entry.getJournalEntryId(),
                lineNumber++,
                line.getAccountCode(),
                line.getSide().name(),
                line.getAmount().getAmount(),
                line.getAmount().getCurrency().name(),
                line.getExchangeRate(),
                line.getSettlementAmount().getAmount(),
                line.getSettlementAmount().getCurrency().name(),
                line.getDescription()
            );
        }
    }

    private void updateAccountRow(Account account) {
        jdbcTemplate.update(
            "UPDATE accounts SET account_name = ?, parent_account_code = ?, active = ?, posting_allowed = ?, " +
            "balance = ?, accumulated_depreciation_code = ?, depreciation_expense_code = ?, " +
            "allowance_account_code = ?, updated_at = ?, deactivated_at = ? WHERE tenant_id = ? AND account_code = ?",
            account.getAccountName(),
            account.getParentAccountCode(),
            account.isActive(),
            account.isPostingAllowed(),
            account.getBalance().getAmount(),
            account.getCompanionLinks().getAccumulatedDepreciationCode(),
            account.getCompanionLinks().getDepreciationExpenseCode(),
            account.getCompanionLinks().getAllowanceAccountCode(),
            Timestamp.from(account.getUpdatedAt()),
            toTimestamp(account.getDeactivatedAt()),
            account.getTenantId(),
            account.getAccountCode()
        );
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            CurrencyCode currency = CurrencyCode.valueOf(rs.getString("currency").trim());
            return Account.restore(AccountProperties.builder()
                .tenantId(rs.getString("tenant_id"))
                .accountCode(rs.getString("account_code"))
                .accountName(rs.getString("account_name"))
                .accountType(AccountType.valueOf(rs.getString("account_type")))
                .specialAccountType(SpecialAccountType.valueOf(rs.getString("special_account_type")))
                .parentAccountCode(rs.getString("parent_account_code"))
                .active(rs.getBoolean("active"))
                .postingAllowed(rs.getBoolean("posting_allowed"))
                .currency(currency)
                .balance(Money.of(rs.getBigDecimal("balance"), currency))
                .companionLinks(CompanionLinks.builder()
                    .accumulatedDepreciationCode(rs.getString("accumulated_depreciation_code"))
                    .depreciationExpenseCode(rs.getString("depreciation_expense_code"))
                    .allowanceAccountCode(rs.getString("allowance_account_code"))
                    .build())
                .createdAt(toInstant(rs, "created_at"))
                .updatedAt(toInstant(rs, "updated_at"))
                .deactivatedAt(toInstant(rs, "deactivated_at"))
                .build());
        };
    }

    private RowMapper<JournalEntry.JournalEntryBuilder> entryRowMapper() {
        return (rs, rowNum) -> JournalEntry.builder()
            .tenantId(rs.getString("tenant_id"))
            .journalEntryId(rs.getString("journal_entry_id"))
            .reference(rs.getString("reference"))
            .description(rs.getString("description"))
            .postingDate(rs.getDate("posting_date").toLocalDate())
            .accountingPeriod(rs.getString("accounting_period"))
            .entryKind(EntryKind.valueOf(rs.getString("entry_kind")))
            .postedBy(rs.getString("posted_by"))
            .postedAt(toInstant(rs, "posted_at"))
            .reversalOf(rs.getString("reversal_of"))
            .reversedBy(rs.getString("reversed_by"))
            .reversalReason(rs.getString("reversal_reason"));
    }

    private RowMapper<JournalEntryLine> lineRowMapper() {
        return (rs, rowNum) -> {
            CurrencyCode currency = CurrencyCode.valueOf(rs.getString("currency").trim());
            CurrencyCode settlementCurrency = CurrencyCode.valueOf(rs.getString("settlement_currency").trim());
            return JournalEntryLine.restore(
                rs.getString("account_code"),
                EntryType.valueOf(rs.getString("side")),
                Money.of(rs.getBigDecimal("amount"), currency),
                rs.getBigDecimal("exchange_rate"),
                Money.of(rs.getBigDecimal("settlement_amount"), settlementCurrency),
                rs.getString("description")
            );
        };
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
