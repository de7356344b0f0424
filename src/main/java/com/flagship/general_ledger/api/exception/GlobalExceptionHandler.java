package com.flagship.general_ledger.api.exception;

import com.flagship.general_ledger.exception.ErrorCode;
import com.flagship.general_ledger.exception.ImbalanceException;
import com.flagship.general_ledger.exception.IntegrityException;
import com.flagship.general_ledger.exception.LedgerException;
import com.flagship.general_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger rejections and request errors to {@link ApiError} bodies.
 *
 * Expected rejections are logged at warn level; anything unmapped is a 500
 * and logged at error level with its stack trace.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        log.warn("Ledger request rejected: code={}, status={}, message={}",
            e.getErrorCode(), status.value(), e.getMessage());

        ApiError.ApiErrorBuilder error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(e.getErrorCode().name())
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now());
        if (e instanceof ImbalanceException) {
            ImbalanceException imbalance = (ImbalanceException) e;
            error.details(Map.of(
                "currency", imbalance.getCurrency(),
                "total_debits", imbalance.getDebitTotal().toPlainString(),
                "total_credits", imbalance.getCreditTotal().toPlainString()));
        } else if (e instanceof IntegrityException) {
            error.details(Map.of("issue_count", String.valueOf(((IntegrityException) e).getIssueCount())));
        }
        return ResponseEntity.status(status).body(error.build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return badRequest("Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return badRequest("Malformed request: " + e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return badRequest(e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION_FAILED, IMBALANCED_ENTRY, POLARITY_VIOLATION, ACCOUNT_INACTIVE, POSTING_NOT_ALLOWED ->
                HttpStatus.BAD_REQUEST;
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_ENTRY, DUPLICATE_ACCOUNT, PERIOD_CLOSED, ILLEGAL_PERIOD_TRANSITION, REVERSAL_REJECTED,
                INTEGRITY_VIOLATION, CONCURRENT_POSTING -> HttpStatus.CONFLICT;
            case POSTING_LOCK_TIMEOUT -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ApiError> badRequest(String message, Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error("Validation Failed")
            .code(ErrorCode.VALIDATION_FAILED.name())
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
