package com.flagship.general_ledger.store;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.exception.ConcurrentPostingException;
import com.flagship.general_ledger.exception.DuplicateAccountException;
import com.flagship.general_ledger.exception.DuplicateEntryException;
import com.flagship.general_ledger.exception.ReversalException;
import com.flagship.general_ledger.journal.JournalEntry;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link LedgerStore}. Every write runs under the write lock, so
 * a posting is visible all at once or not at all.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, TreeMap<String, Account>> accounts = new ConcurrentHashMap<>();
    private final Map<String, List<JournalEntry>> journal = new ConcurrentHashMap<>();

    @Override
    public Optional<Account> loadAccount(String tenantId, String accountCode) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(accountsOf(tenantId).get(accountCode));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Account> loadAccounts(String tenantId) {
        lock.readLock().lock();
        try {
            return new ArrayList<>(accountsOf(tenantId).values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insertAccount(Account account) {
        lock.writeLock().lock();
        try {
            TreeMap<String, Account> tenantAccounts = accountsOf(account.getTenantId());
            if (tenantAccounts.containsKey(account.getAccountCode())) {
                throw new DuplicateAccountException(String.format(
                    "Account %s already exists for tenant %s", account.getAccountCode(), account.getTenantId()));
            }
            tenantAccounts.put(account.getAccountCode(), account);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void saveAccounts(List<Account> updated) {
        lock.writeLock().lock();
        try {
            updated.forEach(account -> accountsOf(account.getTenantId()).put(account.getAccountCode(), account));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void appendJournalEntry(JournalEntry entry) {
        lock.writeLock().lock();
        try {
            if (findEntry(entry.getTenantId(), entry.getJournalEntryId()) >= 0) {
                throw new DuplicateEntryException(entry.getTenantId(), entry.getJournalEntryId());
            }
            journalOf(entry.getTenantId()).add(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void applyPosting(PostingBatch batch) {
        lock.writeLock().lock();
        try {
            String tenantId = batch.getTenantId();
            TreeMap<String, Account> tenantAccounts = accountsOf(tenantId);
            for (Account previous : batch.getPreviousAccounts()) {
                Account stored = tenantAccounts.get(previous.getAccountCode());
                if (stored == null || !stored.getBalance().equals(previous.getBalance())) {
                    throw new ConcurrentPostingException(String.format(
                        "Account %s changed while entry %s was being posted",
                        previous.getAccountCode(), batch.getEntry().getJournalEntryId()));
                }
            }
            if (findEntry(tenantId, batch.getEntry().getJournalEntryId()) >= 0) {
                throw new DuplicateEntryException(tenantId, batch.getEntry().getJournalEntryId());
            }
            int originalIndex = -1;
            JournalEntry reversedOriginal = null;
            String reversedEntryId = batch.getReversedEntryId();
            if (reversedEntryId != null) {
                originalIndex = findEntry(tenantId, reversedEntryId);
                if (originalIndex < 0) {
                    throw new ReversalException("Journal entry not found: " + reversedEntryId);
                }
                reversedOriginal = journalOf(tenantId).get(originalIndex)
                    .markReversedBy(batch.getEntry().getJournalEntryId());
            }

            // All checks passed; nothing below can fail.
            batch.getUpdatedAccounts().forEach(account -> tenantAccounts.put(account.getAccountCode(), account));
            if (reversedOriginal != null) {
                journalOf(tenantId).set(originalIndex, reversedOriginal);
            }
            journalOf(tenantId).add(batch.getEntry());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<JournalEntry> loadJournalEntry(String tenantId, String journalEntryId) {
        lock.readLock().lock();
        try {
            int index = findEntry(tenantId, journalEntryId);
            return index < 0 ? Optional.empty() : Optional.of(journalOf(tenantId).get(index));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean journalEntryExists(String tenantId, String journalEntryId) {
        return loadJournalEntry(tenantId, journalEntryId).isPresent();
    }

    @Override
    public List<JournalEntry> loadJournalHistory(String tenantId, LocalDate upToDate) {
        lock.readLock().lock();
        try {
            return history(tenantId, upToDate);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public LedgerSnapshot loadSnapshot(String tenantId, LocalDate upToDate) {
        lock.readLock().lock();
        try {
            return new LedgerSnapshot(tenantId, upToDate,
                new ArrayList<>(accountsOf(tenantId).values()), history(tenantId, upToDate));
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<JournalEntry> history(String tenantId, LocalDate upToDate) {
        List<JournalEntry> entries = journal.getOrDefault(tenantId, List.of());
        if (upToDate == null) {
            return new ArrayList<>(entries);
        }
        return entries.stream()
            .filter(entry -> !entry.getPostingDate().isAfter(upToDate))
            .toList();
    }

    private int findEntry(String tenantId, String journalEntryId) {
        List<JournalEntry> entries = journal.getOrDefault(tenantId, List.of());
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getJournalEntryId().equals(journalEntryId)) {
                return i;
            }
        }
        return -1;
    }

    private TreeMap<String, Account> accountsOf(String tenantId) {
        return accounts.computeIfAbsent(tenantId, id -> new TreeMap<>());
    }

    private List<JournalEntry> journalOf(String tenantId) {
        return journal.computeIfAbsent(tenantId, id -> new ArrayList<>());
    }
}
