package com.flagship.event_ledger.web;

import com.flagship.event_ledger.common.StorageFailureException;
import com.flagship.event_ledger.listing.ConcurrencyConflictException;
import com.flagship.event_ledger.listing.ListingNotFoundException;
import com.flagship.event_ledger.reconciliation.ReconciliationInProgressException;
import com.flagship.event_ledger.reconciliation.ReportNotFoundException;
import com.flagship.event_ledger.reconciliation.RuleExecutionException;
import com.flagship.event_ledger.reconciliation.RuleNotFoundException;
import com.flagship.event_ledger.wagering.BetNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the service exceptions to {@link ApiError} bodies. Stack traces stay in the log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict: {}", e.getMessage());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("aggregateId", e.getAggregateId());
        details.put("expectedVersion", e.getExpectedVersion());
        details.put("actualVersion", e.getActualVersion());
        return respond(HttpStatus.CONFLICT, "CONCURRENCY_CONFLICT", "Concurrency Conflict", e.getMessage(), details);
    }

    @ExceptionHandler({ListingNotFoundException.class, ReportNotFoundException.class, BetNotFoundException.class,
            RuleNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(ReconciliationInProgressException.class)
    public ResponseEntity<ApiError> handleReconciliationRunning(ReconciliationInProgressException e) {
        log.warn("Reconciliation rejected: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "RECONCILIATION_RUNNING", "Reconciliation Running", e.getMessage(), null);
    }

    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<ApiError> handleStorageFailure(StorageFailureException e) {
        log.error("Storage failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_FAILURE", "Storage Failure",
                "The operation could not be persisted", null);
    }

    @ExceptionHandler(RuleExecutionException.class)
    public ResponseEntity<ApiError> handleRuleFailure(RuleExecutionException e) {
        log.error("Reconciliation rule {} failed", e.getRuleName(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "RULE_EXECUTION_FAILURE", "Rule Execution Failure",
                "Reconciliation rule " + e.getRuleName() + " failed", Map.of("rule", e.getRuleName()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> errors.putIfAbsent(error.getField(),
                error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Validation Failed",
                "Request validation failed", errors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleParameterValidation(HandlerMethodValidationException e) {
        log.warn("Parameter validation failed: {}", e.getMessage());

        Map<String, Object> errors = new LinkedHashMap<>();
        e.getAllValidationResults().forEach(result -> {
            String name = result.getMethodParameter().getParameterName();
            String key = name != null ? name : "arg" + result.getMethodParameter().getParameterIndex();
            result.getResolvableErrors().forEach(error -> errors.putIfAbsent(key,
                    error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));
        });
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Validation Failed",
                "Request validation failed", errors);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadParameter(Exception e) {
        log.warn("Bad request parameter: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_STATE", "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String code, String error,
                                             String message, Map<String, Object> details) {
        ApiError body = ApiError.builder()
                .code(code)
                .error(error)
                .message(message)
                .details(details)
                .timestamp(clock.instant())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
