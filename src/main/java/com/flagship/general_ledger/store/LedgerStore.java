package com.flagship.general_ledger.store;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.journal.JournalEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for accounts and journal entries.
 *
 * Implementations must make {@link #applyPosting(PostingBatch)} atomic: the
 * entry, every changed account and the reversal back-link are written together
 * or not at all. Reads through {@link #loadSnapshot(String, LocalDate)} must
 * never observe half of a posting.
 */
public interface LedgerStore {

    Optional<Account> loadAccount(String tenantId, String accountCode);

    /**
     * All accounts of the tenant in ascending account-code order.
     */
    List<Account> loadAccounts(String tenantId);

    /**
     * @throws com.flagship.general_ledger.exception.DuplicateAccountException if the code is taken
     */
    void insertAccount(Account account);

    /**
     * Replaces stored account rows as given. The services use it for
     * activation and companion-link changes; postings go through
     * {@link #applyPosting(PostingBatch)}.
     */
    void saveAccounts(List<Account> accounts);

    /**
     * Appends an entry without touching balances. Intended for imports and
     * for tests that need to fabricate inconsistent history.
     */
    void appendJournalEntry(JournalEntry entry);

    void applyPosting(PostingBatch batch);

    Optional<JournalEntry> loadJournalEntry(String tenantId, String journalEntryId);

    boolean journalEntryExists(String tenantId, String journalEntryId);

    /**
     * Entries in posting order, optionally limited to posting dates on or
     * before {@code upToDate}.
     */
    List<JournalEntry> loadJournalHistory(String tenantId, LocalDate upToDate);

    /**
     * Accounts and history read together from one consistent view.
     */
    LedgerSnapshot loadSnapshot(String tenantId, LocalDate upToDate);
}
