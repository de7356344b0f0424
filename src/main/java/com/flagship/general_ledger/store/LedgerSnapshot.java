package com.flagship.general_ledger.store;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.journal.JournalEntry;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accounts and journal history of one tenant read from a single consistent
 * view. {@code upToDate} is {@code null} when the full history was read.
 */
@Value
public class LedgerSnapshot {
    String tenantId;
    LocalDate upToDate;
    List<Account> accounts;
    List<JournalEntry> entries;

    public LedgerSnapshot(String tenantId, LocalDate upToDate, List<Account> accounts, List<JournalEntry> entries) {
        this.tenantId = tenantId;
        this.upToDate = upToDate;
        this.accounts = List.copyOf(accounts);
        this.entries = List.copyOf(entries);
    }

    public Map<String, Account> accountsByCode() {
        Map<String, Account> byCode = new LinkedHashMap<>();
        accounts.forEach(account -> byCode.put(account.getAccountCode(), account));
        return byCode;
    }
}
