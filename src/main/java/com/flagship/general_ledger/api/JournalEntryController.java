package com.flagship.general_ledger.api;

import com.flagship.general_ledger.api.dto.JournalEntryResponse;
import com.flagship.general_ledger.api.dto.PostJournalEntryRequest;
import com.flagship.general_ledger.api.dto.ReverseJournalEntryRequest;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Posting and reversing journal entries.
 *
 * Posting is not idempotent: resubmitting an entry id is rejected with 409
 * rather than returning the stored entry.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/journal-entries")
@RequiredArgsConstructor
@Slf4j
public class JournalEntryController {

    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> postJournalEntry(@PathVariable("tenantId") String tenantId,
                                                                 @Valid @RequestBody PostJournalEntryRequest request) {
        log.info("Received posting request: tenantId={}, journalEntryId={}, lines={}",
            tenantId, request.getJournalEntryId(), request.getLines().size());
        JournalEntry posted = ledgerService.post(request.toCommand(tenantId));
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(posted));
    }

    @PostMapping("/{journalEntryId}/reversal")
    public ResponseEntity<JournalEntryResponse> reverseJournalEntry(
            @PathVariable("tenantId") String tenantId,
            @PathVariable("journalEntryId") String journalEntryId,
            @Valid @RequestBody ReverseJournalEntryRequest request) {
        log.info("Received reversal request: tenantId={}, journalEntryId={}", tenantId, journalEntryId);
        JournalEntry reversal = ledgerService.reverse(request.toCommand(tenantId, journalEntryId));
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(reversal));
    }

    @GetMapping("/{journalEntryId}")
    public ResponseEntity<JournalEntryResponse> getJournalEntry(@PathVariable("tenantId") String tenantId,
                                                                @PathVariable("journalEntryId") String journalEntryId) {
        return ledgerService.getJournalEntry(tenantId, journalEntryId)
            .map(entry -> ResponseEntity.ok(JournalEntryResponse.from(entry)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<JournalEntryResponse> listJournalEntries(@PathVariable("tenantId") String tenantId,
                                                         @RequestParam(value = "periodId", required = false)
                                                         String periodId) {
        return ledgerService.listJournalEntries(tenantId, periodId).stream()
            .map(JournalEntryResponse::from)
            .collect(Collectors.toList());
    }
}
