package com.flagship.general_ledger.api;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountService;
import com.flagship.general_ledger.account.CreateAccountCommand;
import com.flagship.general_ledger.api.dto.AccountResponse;
import com.flagship.general_ledger.api.dto.CompanionLinksRequest;
import com.flagship.general_ledger.api.dto.CreateAccountRequest;
import com.flagship.general_ledger.money.CurrencyCode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Chart of accounts of one tenant.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@PathVariable("tenantId") String tenantId,
                                                         @Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: tenantId={}, accountCode={}, type={}",
            tenantId, request.getAccountCode(), request.getAccountType());

        CreateAccountCommand command = CreateAccountCommand.builder()
            .tenantId(tenantId)
            .accountCode(request.getAccountCode())
            .accountName(request.getAccountName())
            .accountType(request.getAccountType())
            .specialAccountType(request.getSpecialAccountType())
            .parentAccountCode(request.getParentAccountCode())
            .postingAllowed(request.getPostingAllowed())
            .currency(request.getCurrency() != null ? CurrencyCode.valueOf(request.getCurrency()) : null)
            .companionLinks(request.getCompanionLinks() != null ? request.getCompanionLinks().toLinks() : null)
            .build();

        Account account = accountService.createAccount(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(@PathVariable("tenantId") String tenantId) {
        return accountService.listAccounts(tenantId).stream()
            .map(AccountResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/{accountCode}")
    public AccountResponse getAccount(@PathVariable("tenantId") String tenantId,
                                      @PathVariable("accountCode") String accountCode) {
        return AccountResponse.from(accountService.getAccount(tenantId, accountCode));
    }

    @PostMapping("/{accountCode}/activate")
    public AccountResponse activateAccount(@PathVariable("tenantId") String tenantId,
                                           @PathVariable("accountCode") String accountCode) {
        return AccountResponse.from(accountService.activateAccount(tenantId, accountCode));
    }

    @PostMapping("/{accountCode}/deactivate")
    public AccountResponse deactivateAccount(@PathVariable("tenantId") String tenantId,
                                             @PathVariable("accountCode") String accountCode) {
        return AccountResponse.from(accountService.deactivateAccount(tenantId, accountCode));
    }

    @PutMapping("/{accountCode}/companions")
    public AccountResponse linkCompanionAccounts(@PathVariable("tenantId") String tenantId,
                                                 @PathVariable("accountCode") String accountCode,
                                                 @RequestBody CompanionLinksRequest request) {
        return AccountResponse.from(accountService.linkCompanionAccounts(tenantId, accountCode, request.toLinks()));
    }
}
