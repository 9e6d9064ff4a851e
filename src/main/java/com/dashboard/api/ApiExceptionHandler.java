package com.dashboard.api;

import com.dashboard.domain.exception.PartialAggregateFailureException;
import com.dashboard.domain.exception.PersistenceFailureException;
import com.dashboard.domain.exception.ShardUnavailableException;
import com.dashboard.domain.exception.UnknownTenantException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps statistics failures to HTTP responses.
 * 
 * - Unknown AC: 404, not worth retrying
 * - Shard or aggregate failure: 503, the next request or refresh may succeed
 * - Snapshot store failure (overview): 503
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {
    
    @ExceptionHandler(UnknownTenantException.class)
    public ResponseEntity<ErrorResponse> handleUnknownTenant(UnknownTenantException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid value for " + e.getName() + ": " + e.getValue());
    }
    
    @ExceptionHandler({ShardUnavailableException.class, PartialAggregateFailureException.class})
    public ResponseEntity<ErrorResponse> handleComputationFailure(RuntimeException e) {
        log.warn("Stats temporarily unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }
    
    @ExceptionHandler(PersistenceFailureException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceFailure(PersistenceFailureException e) {
        log.error("Snapshot store failure: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Precomputed statistics temporarily unavailable");
    }
    
    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
