package com.flagship.general_ledger.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response. {@code code} is the ledger's
 * {@link com.flagship.general_ledger.exception.ErrorCode} when one applies.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String code;
    String message;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;
}
