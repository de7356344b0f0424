package com.flagship.general_ledger.api;

import com.flagship.general_ledger.api.dto.CreatePeriodRequest;
import com.flagship.general_ledger.api.dto.PeriodResponse;
import com.flagship.general_ledger.api.dto.PeriodTransitionRequest;
import com.flagship.general_ledger.api.dto.PostingPolicyRequest;
import com.flagship.general_ledger.period.AccountingPeriod;
import com.flagship.general_ledger.period.PeriodCloseService;
import com.flagship.general_ledger.period.PeriodGate;
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

@RestController
@RequestMapping("/api/tenants/{tenantId}/periods")
@RequiredArgsConstructor
@Slf4j
public class PeriodController {

    private final PeriodGate periodGate;
    private final PeriodCloseService periodCloseService;

    @PostMapping
    public ResponseEntity<PeriodResponse> createPeriod(@PathVariable("tenantId") String tenantId,
                                                       @Valid @RequestBody CreatePeriodRequest request) {
        AccountingPeriod period = periodGate.createPeriod(
            tenantId, request.getFiscalYear(), request.getPeriodType(), request.getPeriodNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(PeriodResponse.from(period));
    }

    @GetMapping
    public List<PeriodResponse> listPeriods(@PathVariable("tenantId") String tenantId) {
        return periodGate.listPeriods(tenantId).stream()
            .map(PeriodResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/{periodId}")
    public ResponseEntity<PeriodResponse> getPeriod(@PathVariable("tenantId") String tenantId,
                                                    @PathVariable("periodId") String periodId) {
        return periodGate.getPeriod(tenantId, periodId)
            .map(period -> ResponseEntity.ok(PeriodResponse.from(period)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{periodId}/transition")
    public PeriodResponse transition(@PathVariable("tenantId") String tenantId,
                                     @PathVariable("periodId") String periodId,
                                     @Valid @RequestBody PeriodTransitionRequest request) {
        log.info("Received period transition request: tenantId={}, periodId={}, target={}",
            tenantId, periodId, request.getStatus());
        return PeriodResponse.from(periodGate.transition(tenantId, periodId, request.getStatus()));
    }

    @PutMapping("/{periodId}/posting-policy")
    public PeriodResponse updatePostingPolicy(@PathVariable("tenantId") String tenantId,
                                              @PathVariable("periodId") String periodId,
                                              @Valid @RequestBody PostingPolicyRequest request) {
        return PeriodResponse.from(periodGate.updatePostingPolicy(
            tenantId, periodId, request.getAllowAdjustments(), request.getAllowClosingEntries()));
    }

    /**
     * Closes the period after an integrity check; 409 when drift exists.
     */
    @PostMapping("/{periodId}/close")
    public PeriodResponse closePeriod(@PathVariable("tenantId") String tenantId,
                                      @PathVariable("periodId") String periodId) {
        log.info("Received period close request: tenantId={}, periodId={}", tenantId, periodId);
        return PeriodResponse.from(periodCloseService.closePeriod(tenantId, periodId));
    }
}
