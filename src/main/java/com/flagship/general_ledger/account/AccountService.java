package com.flagship.general_ledger.account;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.exception.AccountNotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.PostingLockManager;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Service for managing the chart of accounts.
 *
 * Account changes run inside the tenant's posting section: a posting holds
 * loaded account versions while it validates, and an activation saved in
 * between would otherwise be overwritten.
 */
@Slf4j
@Service
public class AccountService {

    private final LedgerStore ledgerStore;
    private final PostingLockManager lockManager;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public AccountService(LedgerStore ledgerStore, PostingLockManager lockManager,
                          LedgerProperties properties, LedgerMetrics metrics, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.lockManager = lockManager;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Opens an account with a zero balance.
     *
     * @throws com.flagship.general_ledger.exception.DuplicateAccountException if the code is taken
     * @throws ValidationException if the parent does not exist or the account is malformed
     * @throws AccountNotFoundException if a companion link target does not exist
     */
    public Account createAccount(CreateAccountCommand command) {
        CurrencyCode currency = command.getCurrency() != null
            ? command.getCurrency()
            : properties.getReportingCurrency();
        Instant now = clock.instant();

        Account account = Account.create(AccountProperties.builder()
            .tenantId(command.getTenantId())
            .accountCode(command.getAccountCode())
            .accountName(command.getAccountName())
            .accountType(command.getAccountType())
            .specialAccountType(command.getSpecialAccountType())
            .parentAccountCode(command.getParentAccountCode())
            .postingAllowed(command.isPostingAllowed())
            .currency(currency)
            .companionLinks(command.getCompanionLinks())
            .createdAt(now)
            .updatedAt(now)
            .build());

        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, account.getTenantId());
        try {
            lockManager.runWithTenantLock(account.getTenantId(), () -> {
                if (account.getParentAccountCode() != null
                        && ledgerStore.loadAccount(account.getTenantId(), account.getParentAccountCode()).isEmpty()) {
                    throw new ValidationException(String.format(
                        "Parent account %s does not exist", account.getParentAccountCode()));
                }
                requireCompanionTargets(account.getTenantId(), account.getCompanionLinks());
                ledgerStore.insertAccount(account);
            });
            metrics.incrementAccountsCreated();
            log.info("Account created: code={}, type={}, special={}, currency={}",
                account.getAccountCode(), account.getAccountType(), account.getSpecialAccountType(), currency);
            return account;
        } finally {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
        }
    }

    /**
     * @throws AccountNotFoundException if the account does not exist
     */
    public Account getAccount(String tenantId, String accountCode) {
        return ledgerStore.loadAccount(tenantId, accountCode)
            .orElseThrow(() -> new AccountNotFoundException(tenantId, accountCode));
    }

    public List<Account> listAccounts(String tenantId) {
        return ledgerStore.loadAccounts(tenantId);
    }

    public Account activateAccount(String tenantId, String accountCode) {
        return update(tenantId, accountCode, "activated", account -> account.activate(clock.instant()));
    }

    public Account deactivateAccount(String tenantId, String accountCode) {
        return update(tenantId, accountCode, "deactivated", account -> account.deactivate(clock.instant()));
    }

    /**
     * Replaces the account's companion links. Every target must exist.
     */
    public Account linkCompanionAccounts(String tenantId, String accountCode, CompanionLinks links) {
        return update(tenantId, accountCode, "linked", account -> {
            CompanionLinks requested = links != null ? links : CompanionLinks.NONE;
            Account linked = account.withCompanionLinks(requested, clock.instant());
            requireCompanionTargets(tenantId, linked.getCompanionLinks());
            return linked;
        });
    }

    private Account update(String tenantId, String accountCode, String action,
                           UnaryOperator<Account> change) {
        return lockManager.withTenantLock(tenantId, () -> {
            Account current = getAccount(tenantId, accountCode);
            Account updated = change.apply(current);
            ledgerStore.saveAccounts(List.of(updated));
            log.info("Account {}: tenantId={}, code={}", action, tenantId, accountCode);
            return updated;
        });
    }

    private void requireCompanionTargets(String tenantId, CompanionLinks links) {
        for (Map.Entry<SpecialAccountType, String> target : links.targets().entrySet()) {
            if (ledgerStore.loadAccount(tenantId, target.getValue()).isEmpty()) {
                throw new AccountNotFoundException(tenantId, target.getValue());
            }
        }
    }
}
