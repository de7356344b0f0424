package com.flagship.general_ledger.account;

import com.flagship.general_ledger.exception.AccountNotFoundException;
import com.flagship.general_ledger.exception.DuplicateAccountException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.flagship.general_ledger.support.LedgerFixtures.TENANT;
import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest {

    private LedgerFixtures ledger;
    private AccountService accountService;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixtures();
        accountService = ledger.accountService;
    }

    private CreateAccountCommand.CreateAccountCommandBuilder command(String code, AccountType type) {
        return CreateAccountCommand.builder()
            .tenantId(TENANT)
            .accountCode(code)
            .accountName(code + " account")
            .accountType(type);
    }

    @Test
    @DisplayName("New accounts open at zero in the reporting currency by default")
    void testCreateAccountDefaults() {
        Account account = accountService.createAccount(command("CASH", AccountType.ASSET).build());

        assertEquals(Money.zero(CurrencyCode.USD), account.getBalance());
        assertTrue(account.isPostingAllowed());
        assertEquals(account, accountService.getAccount(TENANT, "CASH"));
        assertEquals(1.0, ledger.meterRegistry.get("ledger.accounts.created").counter().count());
    }

    @Test
    @DisplayName("Account codes are unique per tenant, not globally")
    void testDuplicateAccount() {
        accountService.createAccount(command("CASH", AccountType.ASSET).build());

        assertThrows(DuplicateAccountException.class,
            () -> accountService.createAccount(command("CASH", AccountType.ASSET).build()));
        assertDoesNotThrow(() -> accountService.createAccount(CreateAccountCommand.builder()
            .tenantId("globex")
            .accountCode("CASH")
            .accountName("Cash")
            .accountType(AccountType.ASSET)
            .build()));
    }

    @Test
    @DisplayName("A parent account must exist")
    void testParentMustExist() {
        assertThrows(ValidationException.class,
            () -> accountService.createAccount(command("CASH01", AccountType.ASSET).parentAccountCode("CASH").build()));

        accountService.createAccount(command("CASH", AccountType.ASSET).postingAllowed(false).build());
        Account child = accountService.createAccount(
            command("CASH01", AccountType.ASSET).parentAccountCode("CASH").build());
        assertEquals("CASH", child.getParentAccountCode());
    }

    @Test
    @DisplayName("Companion links must point at existing accounts")
    void testCompanionTargetsMustExist() {
        CompanionLinks links = CompanionLinks.builder().accumulatedDepreciationCode("ACCDEP").build();

        assertThrows(AccountNotFoundException.class,
            () -> accountService.createAccount(command("EQUIP", AccountType.ASSET).companionLinks(links).build()));

        accountService.createAccount(command("ACCDEP", AccountType.ASSET)
            .specialAccountType(SpecialAccountType.ACCUMULATED_DEPRECIATION).build());
        Account equipment = accountService.createAccount(
            command("EQUIP", AccountType.ASSET).companionLinks(links).build());
        assertEquals("ACCDEP", equipment.getCompanionLinks().getAccumulatedDepreciationCode());
    }

    @Test
    @DisplayName("Linking companions replaces the links and stamps the update")
    void testLinkCompanionAccounts() {
        accountService.createAccount(command("EQUIP", AccountType.ASSET).build());
        accountService.createAccount(command("DEPEXP", AccountType.EXPENSE)
            .specialAccountType(SpecialAccountType.DEPRECIATION_EXPENSE).build());
        ledger.clock.advance(Duration.ofHours(1));

        Account linked = accountService.linkCompanionAccounts(TENANT, "EQUIP",
            CompanionLinks.builder().depreciationExpenseCode(" DEPEXP ").build());

        assertEquals("DEPEXP", linked.getCompanionLinks().getDepreciationExpenseCode());
        assertEquals(ledger.clock.instant(), linked.getUpdatedAt());
        assertEquals(linked, accountService.getAccount(TENANT, "EQUIP"));
        assertThrows(AccountNotFoundException.class, () -> accountService.linkCompanionAccounts(TENANT, "EQUIP",
            CompanionLinks.builder().allowanceAccountCode("NOPE").build()));
    }

    @Test
    @DisplayName("Deactivation and activation are stored")
    void testActivation() {
        accountService.createAccount(command("CASH", AccountType.ASSET).build());

        assertFalse(accountService.deactivateAccount(TENANT, "CASH").isActive());
        assertFalse(accountService.getAccount(TENANT, "CASH").isActive());
        assertTrue(accountService.activateAccount(TENANT, "CASH").isActive());
    }

    @Test
    @DisplayName("Unknown accounts raise AccountNotFoundException")
    void testUnknownAccount() {
        assertThrows(AccountNotFoundException.class, () -> accountService.getAccount(TENANT, "NOPE"));
        assertThrows(AccountNotFoundException.class, () -> accountService.deactivateAccount(TENANT, "NOPE"));
    }

    @Test
    @DisplayName("Accounts are listed in code order")
    void testListAccounts() {
        accountService.createAccount(command("SALES", AccountType.REVENUE).build());
        accountService.createAccount(command("CASH", AccountType.ASSET).build());
        accountService.createAccount(command("APC", AccountType.LIABILITY).build());

        assertEquals(List.of("APC", "CASH", "SALES"),
            accountService.listAccounts(TENANT).stream().map(Account::getAccountCode).toList());
    }
}
