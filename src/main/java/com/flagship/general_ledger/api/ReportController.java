package com.flagship.general_ledger.api;

import com.flagship.general_ledger.integrity.ExceptionReport;
import com.flagship.general_ledger.integrity.IntegrityReport;
import com.flagship.general_ledger.integrity.IntegrityService;
import com.flagship.general_ledger.integrity.ReconciliationReport;
import com.flagship.general_ledger.reporting.BalanceSheet;
import com.flagship.general_ledger.reporting.BalanceSource;
import com.flagship.general_ledger.reporting.CashFlowStatement;
import com.flagship.general_ledger.reporting.FinancialStatementService;
import com.flagship.general_ledger.reporting.ProfitAndLossStatement;
import com.flagship.general_ledger.reporting.TrialBalance;
import com.flagship.general_ledger.reporting.TrialBalanceService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Read-only reports. None of these take the posting lock.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/reports")
@RequiredArgsConstructor
public class ReportController {

    private final TrialBalanceService trialBalanceService;
    private final FinancialStatementService financialStatementService;
    private final IntegrityService integrityService;

    /**
     * Stored balances by default; replayed balances when {@code asOfDate} or
     * {@code source=REPLAY} is given.
     */
    @GetMapping("/trial-balance")
    public TrialBalance getTrialBalance(
            @PathVariable("tenantId") String tenantId,
            @RequestParam(value = "periodId", required = false) String periodId,
            @RequestParam(value = "asOfDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate,
            @RequestParam(value = "source", required = false) BalanceSource source) {
        if (source == null) {
            return trialBalanceService.computeTrialBalance(tenantId, periodId, asOfDate);
        }
        return trialBalanceService.computeTrialBalance(tenantId, periodId, asOfDate, source);
    }

    @GetMapping("/profit-and-loss")
    public ProfitAndLossStatement getProfitAndLoss(@PathVariable("tenantId") String tenantId,
                                                   @RequestParam("periodId") String periodId) {
        return financialStatementService.getProfitAndLoss(tenantId, periodId);
    }

    @GetMapping("/balance-sheet")
    public BalanceSheet getBalanceSheet(@PathVariable("tenantId") String tenantId,
                                        @RequestParam(value = "asOfDate", required = false)
                                        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate) {
        return financialStatementService.getBalanceSheet(tenantId, asOfDate);
    }

    @GetMapping("/cash-flow")
    public CashFlowStatement getCashFlowStatement(@PathVariable("tenantId") String tenantId,
                                                  @RequestParam("periodId") String periodId) {
        return financialStatementService.getCashFlowStatement(tenantId, periodId);
    }

    @GetMapping("/integrity")
    public IntegrityReport validateIntegrity(@PathVariable("tenantId") String tenantId) {
        return integrityService.validateGLIntegrity(tenantId);
    }

    /**
     * Body maps account codes to expected balances (debit-positive). An empty
     * or missing body reconciles against the journal instead.
     */
    @PostMapping("/reconciliation")
    public ReconciliationReport reconcileTrialBalance(
            @PathVariable("tenantId") String tenantId,
            @RequestParam("periodId") String periodId,
            @RequestBody(required = false) Map<String, BigDecimal> expectedBalances) {
        return integrityService.reconcileTrialBalance(tenantId, periodId, expectedBalances);
    }

    @GetMapping("/exceptions")
    public ExceptionReport generateExceptionReport(@PathVariable("tenantId") String tenantId,
                                                   @RequestParam("periodId") String periodId) {
        return integrityService.generateExceptionReport(tenantId, periodId);
    }
}
