package com.flagship.general_ledger.store;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.journal.JournalEntry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one posting writes.
 *
 * {@code previousAccounts} are the versions the engine validated against, in
 * the same order as {@code updatedAccounts}. Stores compare them with what is
 * stored before writing so a concurrent writer is detected instead of
 * overwritten.
 */
@Value
@Builder
public class PostingBatch {
    String tenantId;
    JournalEntry entry;
    @Singular
    List<Account> previousAccounts;
    @Singular
    List<Account> updatedAccounts;

    /**
     * Id of the entry this posting reverses, or {@code null}.
     */
    public String getReversedEntryId() {
        return entry.getReversalOf();
    }
}
