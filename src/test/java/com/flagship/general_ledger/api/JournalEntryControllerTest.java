package com.flagship.general_ledger.api;

import com.flagship.general_ledger.config.JacksonConfig;
import com.flagship.general_ledger.exception.DuplicateEntryException;
import com.flagship.general_ledger.exception.ImbalanceException;
import com.flagship.general_ledger.exception.PeriodClosedException;
import com.flagship.general_ledger.exception.PostingLockTimeoutException;
import com.flagship.general_ledger.journal.EntryKind;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryLine;
import com.flagship.general_ledger.journal.LedgerService;
import com.flagship.general_ledger.journal.PostJournalEntryCommand;
import com.flagship.general_ledger.journal.ReverseJournalEntryCommand;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import com.flagship.general_ledger.observability.CorrelationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JournalEntryController.class)
@Import(JacksonConfig.class)
class JournalEntryControllerTest {

    private static final String ENTRIES = "/api/tenants/acme/journal-entries";

    private static final String VALID_ENTRY = """
        {
          "journal_entry_id": "JE-100",
          "posting_date": "2024-01-15",
          "accounting_period": "2024-01",
          "description": "Cash sale",
          "posted_by": "clerk",
          "lines": [
            {"account_code": "CASH", "debit_amount": 250.00, "currency": "USD"},
            {"account_code": "SALES", "credit_amount": 250.00, "currency": "USD"}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LedgerService ledgerService;

    private static JournalEntry postedEntry(String entryId) {
        Money amount = Money.of("250.00", CurrencyCode.USD);
        return JournalEntry.builder()
            .tenantId("acme")
            .journalEntryId(entryId)
            .description("Cash sale")
            .postingDate(LocalDate.of(2024, 1, 15))
            .accountingPeriod("2024-01")
            .entryKind(EntryKind.STANDARD)
            .postedBy("clerk")
            .postedAt(Instant.parse("2024-01-15T10:00:00Z"))
            .line(JournalEntryLine.debit("CASH", amount, null).settleIn(CurrencyCode.USD))
            .line(JournalEntryLine.credit("SALES", amount, null).settleIn(CurrencyCode.USD))
            .build();
    }

    @Test
    @DisplayName("A valid entry is posted and returned with 201")
    void testPostEntry() throws Exception {
        // Given
        when(ledgerService.post(any(PostJournalEntryCommand.class))).thenReturn(postedEntry("JE-100"));

        // When / Then
        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ENTRY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.journal_entry_id").value("JE-100"))
            .andExpect(jsonPath("$.status").value("POSTED"))
            .andExpect(jsonPath("$.lines.length()").value(2))
            .andExpect(jsonPath("$.lines[0].side").value("DEBIT"))
            .andExpect(jsonPath("$.lines[0].settlement_currency").value("USD"));

        ArgumentCaptor<PostJournalEntryCommand> captor = ArgumentCaptor.forClass(PostJournalEntryCommand.class);
        verify(ledgerService).post(captor.capture());
        PostJournalEntryCommand command = captor.getValue();
        assertEquals("acme", command.getTenantId());
        assertEquals(EntryKind.STANDARD, command.getEntryKind());
        assertEquals(2, command.getLines().size());
        assertTrue(command.getLines().get(0).isDebit());
        assertEquals(0, new BigDecimal("250").compareTo(command.getLines().get(1).getAmount().getAmount()));
    }

    @Test
    @DisplayName("An entry with a single line fails validation before reaching the ledger")
    void testSingleLineRejected() throws Exception {
        String oneLine = """
            {
              "journal_entry_id": "JE-101",
              "posting_date": "2024-01-15",
              "accounting_period": "2024-01",
              "posted_by": "clerk",
              "lines": [
                {"account_code": "CASH", "debit_amount": 10.00, "currency": "USD"}
              ]
            }
            """;

        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(oneLine))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.lines").exists());

        verify(ledgerService, never()).post(any());
    }

    @Test
    @DisplayName("Negative amounts and bad currencies are rejected")
    void testLineValidation() throws Exception {
        String badLines = """
            {
              "journal_entry_id": "JE-102",
              "posting_date": "2024-01-15",
              "accounting_period": "2024-01",
              "posted_by": "clerk",
              "lines": [
                {"account_code": "CASH", "debit_amount": -10.00, "currency": "USD"},
                {"account_code": "SALES", "credit_amount": 10.00, "currency": "usd"}
              ]
            }
            """;

        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(badLines))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details['lines[0].debitAmount']").value("Debit amount cannot be negative"))
            .andExpect(jsonPath("$.details['lines[1].currency']").exists());
    }

    @Test
    @DisplayName("Malformed JSON is a 400")
    void testMalformedBody() throws Exception {
        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"journal_entry_id\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("An imbalance is a 400 carrying the totals")
    void testImbalance() throws Exception {
        when(ledgerService.post(any(PostJournalEntryCommand.class)))
            .thenThrow(new ImbalanceException("USD", new BigDecimal("250.00"), new BigDecimal("240.00")));

        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ENTRY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("IMBALANCED_ENTRY"))
            .andExpect(jsonPath("$.details.currency").value("USD"))
            .andExpect(jsonPath("$.details.total_debits").value("250.00"))
            .andExpect(jsonPath("$.details.total_credits").value("240.00"));
    }

    @Test
    @DisplayName("A reused entry id is a 409")
    void testDuplicate() throws Exception {
        when(ledgerService.post(any(PostJournalEntryCommand.class)))
            .thenThrow(new DuplicateEntryException("acme", "JE-100"));

        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ENTRY))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("DUPLICATE_ENTRY"));
    }

    @Test
    @DisplayName("A closed period is a 409 and a busy tenant a 503")
    void testPeriodClosedAndLockTimeout() throws Exception {
        when(ledgerService.post(any(PostJournalEntryCommand.class)))
            .thenThrow(new PeriodClosedException("2024-01", "Accounting period 2024-01 is CLOSED"))
            .thenThrow(new PostingLockTimeoutException("Tenant acme is busy"));

        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ENTRY))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("PERIOD_CLOSED"));

        mockMvc.perform(post(ENTRIES)
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ENTRY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.code").value("POSTING_LOCK_TIMEOUT"));
    }

    @Test
    @DisplayName("The caller's correlation id is echoed on errors")
    void testCorrelationId() throws Exception {
        when(ledgerService.post(any(PostJournalEntryCommand.class)))
            .thenThrow(new DuplicateEntryException("acme", "JE-100"));

        mockMvc.perform(post(ENTRIES)
                .header(CorrelationContext.CORRELATION_ID_HEADER, "corr-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ENTRY))
            .andExpect(status().isConflict())
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"))
            .andExpect(jsonPath("$.correlationId").value("corr-123"));
    }

    @Test
    @DisplayName("Reversal requires a reason")
    void testReversal() throws Exception {
        JournalEntry reversal = postedEntry("REV-JE-100").toBuilder()
            .entryKind(EntryKind.REVERSAL)
            .reversalOf("JE-100")
            .reversalReason("Duplicate sale")
            .build();
        when(ledgerService.reverse(any(ReverseJournalEntryCommand.class))).thenReturn(reversal);

        mockMvc.perform(post(ENTRIES + "/JE-100/reversal")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"Duplicate sale\", \"reversed_by\": \"controller\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.journal_entry_id").value("REV-JE-100"))
            .andExpect(jsonPath("$.reversal_of").value("JE-100"))
            .andExpect(jsonPath("$.entry_kind").value("REVERSAL"));

        mockMvc.perform(post(ENTRIES + "/JE-100/reversal")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"\", \"reversed_by\": \"controller\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.reason").exists());
    }

    @Test
    @DisplayName("Unknown entries are a 404; listing filters by period")
    void testGetAndList() throws Exception {
        when(ledgerService.getJournalEntry("acme", "JE-404")).thenReturn(Optional.empty());
        when(ledgerService.listJournalEntries(eq("acme"), eq("2024-01"))).thenReturn(List.of(postedEntry("JE-100")));

        mockMvc.perform(get(ENTRIES + "/JE-404"))
            .andExpect(status().isNotFound());

        mockMvc.perform(get(ENTRIES).param("periodId", "2024-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].journal_entry_id").value("JE-100"));
    }
}
