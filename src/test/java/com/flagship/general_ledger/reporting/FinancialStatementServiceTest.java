package com.flagship.general_ledger.reporting;

import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.SpecialAccountType;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flagship.general_ledger.support.LedgerFixtures.FEBRUARY;
import static com.flagship.general_ledger.support.LedgerFixtures.JANUARY;
import static com.flagship.general_ledger.support.LedgerFixtures.TENANT;
import static com.flagship.general_ledger.support.LedgerFixtures.credit;
import static com.flagship.general_ledger.support.LedgerFixtures.debit;
import static com.flagship.general_ledger.support.LedgerFixtures.feb;
import static com.flagship.general_ledger.support.LedgerFixtures.jan;
import static com.flagship.general_ledger.support.LedgerFixtures.usd;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Statements over a small trading month: capital and a loan come in,
 * equipment is bought, goods are sold for cash and on credit, rent is paid.
 */
class FinancialStatementServiceTest {

    private LedgerFixtures ledger;
    private FinancialStatementService statements;

    @BeforeEach
    void setUp() {
        ledger = LedgerFixtures.withStandardChart();
        statements = ledger.financialStatementService;
        ledger.post("JE-1", jan(2), JANUARY, "CASH", "CAPITAL", "10000.00");
        ledger.post("JE-2", jan(3), JANUARY, "CASH", "LOAN", "5000.00");
        ledger.post("JE-3", jan(5), JANUARY, "EQUIP", "CASH", "3000.00");
        ledger.post("JE-4", jan(12), JANUARY, "CASH", "SALES", "2500.00");
        ledger.post("JE-5", jan(18), JANUARY, "ARC", "SALES", "1000.00");
        ledger.post("JE-6", jan(25), JANUARY, "RENT", "CASH", "800.00");
        ledger.post("JE-7", feb(4), FEBRUARY, "CASH", "ARC", "1000.00");
        ledger.post("JE-8", feb(25), FEBRUARY, "RENT", "CASH", "800.00");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Nested
    @DisplayName("Profit and loss")
    class ProfitAndLoss {

        @Test
        @DisplayName("Net income is revenue less expenses within the period")
        void testNetIncome() {
            printTestHeader("January P&L");

            ProfitAndLossStatement january = statements.getProfitAndLoss(TENANT, JANUARY);

            printOutput("Net income", january.getNetIncome());
            assertEquals(CurrencyCode.USD, january.getCurrency());
            assertEquals(usd("3500.00"), january.getTotalRevenue());
            assertEquals(usd("800.00"), january.getTotalExpenses());
            assertEquals(usd("2700.00"), january.getNetIncome());
            assertEquals(1, january.getRevenue().size());
            assertEquals("SALES", january.getRevenue().get(0).getAccountCode());

            ProfitAndLossStatement february = statements.getProfitAndLoss(TENANT, FEBRUARY);
            assertEquals(usd("-800.00"), february.getNetIncome());
            assertTrue(february.getRevenue().isEmpty());
        }

        @Test
        @DisplayName("Closing entries do not zero the statement")
        void testClosingEntriesExcluded() {
            ledger.post("JE-CLOSE", jan(31), JANUARY, EntryKind.CLOSING, List.of(
                debit("SALES", "3500.00"),
                credit("RENT", "800.00"),
                credit("CAPITAL", "2700.00")));

            ProfitAndLossStatement january = statements.getProfitAndLoss(TENANT, JANUARY);

            assertEquals(usd("2700.00"), january.getNetIncome());
            assertEquals(usd("0.00"), ledger.storedAccount("SALES").getBalance());
        }

        @Test
        @DisplayName("Accounts outside the reporting currency are listed as excluded")
        void testForeignAccountsExcluded() {
            ledger.account("SALESEUR", "Sales EUR", AccountType.REVENUE, SpecialAccountType.NONE, CurrencyCode.EUR);

            ProfitAndLossStatement january = statements.getProfitAndLoss(TENANT, JANUARY);

            assertEquals(List.of("SALESEUR"), january.getExcludedAccounts());
            assertEquals(usd("2700.00"), january.getNetIncome());
        }
    }

    @Nested
    @DisplayName("Balance sheet")
    class BalanceSheetStatement {

        @Test
        @DisplayName("Current balances balance with unclosed earnings")
        void testCurrentBalanceSheet() {
            printTestHeader("Current balance sheet");

            BalanceSheet sheet = statements.getBalanceSheet(TENANT, null);

            printOutput("Assets", sheet.getTotalAssets());
            printOutput("Liabilities + equity", sheet.getTotalLiabilitiesAndEquity());
            assertEquals(BalanceSource.STORED, sheet.getSource());
            assertEquals(usd("16900.00"), sheet.getTotalAssets());
            assertEquals(usd("5000.00"), sheet.getTotalLiabilities());
            assertEquals(usd("10000.00"), sheet.getTotalEquity());
            assertEquals(usd("1900.00"), sheet.getCurrentEarnings());
            assertEquals(usd("16900.00"), sheet.getTotalLiabilitiesAndEquity());
            assertTrue(sheet.isBalanced());
        }

        @Test
        @DisplayName("An as-of date replays history to that date")
        void testHistoricalBalanceSheet() {
            BalanceSheet endOfJanuary = statements.getBalanceSheet(TENANT, jan(31));

            assertEquals(BalanceSource.REPLAY, endOfJanuary.getSource());
            assertEquals(usd("17700.00"), endOfJanuary.getTotalAssets());
            assertEquals(usd("2700.00"), endOfJanuary.getCurrentEarnings());
            assertTrue(endOfJanuary.isBalanced());
        }

        @Test
        @DisplayName("A tampered stored balance unbalances the sheet")
        void testTamperedSheet() {
            ledger.tamperBalance("EQUIP", usd("3100.00"));

            BalanceSheet sheet = statements.getBalanceSheet(TENANT, null);

            assertFalse(sheet.isBalanced());
            assertEquals(usd("17000.00"), sheet.getTotalAssets());
        }
    }

    @Nested
    @DisplayName("Cash flow")
    class CashFlow {

        @Test
        @DisplayName("Cash movements are classified by their counter account")
        void testClassification() {
            printTestHeader("January cash flow");

            CashFlowStatement january = statements.getCashFlowStatement(TENANT, JANUARY);

            printOutput("Operating", january.getOperatingActivities());
            printOutput("Investing", january.getInvestingActivities());
            printOutput("Financing", january.getFinancingActivities());
            assertEquals(List.of("CASH"), january.getCashAccounts());
            assertEquals(usd("1700.00"), january.getNetCashFromOperating());
            assertEquals(usd("-3000.00"), january.getNetCashFromInvesting());
            assertEquals(usd("15000.00"), january.getNetCashFromFinancing());
            assertEquals(usd("13700.00"), january.getNetChangeInCash());
            assertEquals(usd("0.00"), january.getBeginningCash());
            assertEquals(usd("13700.00"), january.getEndingCash());
            assertTrue(january.isReconciled());

            CashFlowItem equipment = january.getInvestingActivities().get(0);
            assertEquals("JE-3", equipment.getJournalEntryId());
            assertEquals("EQUIP", equipment.getCounterAccountCode());
        }

        @Test
        @DisplayName("Beginning cash carries over from earlier periods")
        void testBeginningCash() {
            CashFlowStatement february = statements.getCashFlowStatement(TENANT, FEBRUARY);

            assertEquals(usd("13700.00"), february.getBeginningCash());
            assertEquals(usd("200.00"), february.getNetCashFromOperating());
            assertEquals(usd("13900.00"), february.getEndingCash());
            assertTrue(february.isReconciled());
            assertEquals(CashFlowCategory.OPERATING, february.getOperatingActivities().get(0).getCategory());
        }

        @Test
        @DisplayName("Receivable collections count as operating")
        void testControlAccountsAreOperating() {
            assertEquals(CashFlowCategory.OPERATING, CashFlowCategory.classify(ledger.storedAccount("ARC")));
            assertEquals(CashFlowCategory.INVESTING, CashFlowCategory.classify(ledger.storedAccount("EQUIP")));
            assertEquals(CashFlowCategory.FINANCING, CashFlowCategory.classify(ledger.storedAccount("LOAN")));
            assertEquals(CashFlowCategory.OPERATING, CashFlowCategory.classify(null));
        }
    }
}
