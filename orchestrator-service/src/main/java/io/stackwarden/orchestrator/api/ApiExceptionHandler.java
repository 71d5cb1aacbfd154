package io.stackwarden.orchestrator.api;

import io.stackwarden.orchestrator.domain.FailureClass;
import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.orchestrator.domain.StackOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected commands to HTTP responses carrying a stable reason code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StackOperationException.class)
    public ResponseEntity<ErrorResponse> rejected(StackOperationException e) {
        HttpStatus status = statusFor(e.reason());
        log.info("[REST] rejected with {} ({}): {}", status.value(), e.reason(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.reason().name(), e.getMessage(), e.retryable()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .reduce((left, right) -> left + "; " + right)
            .orElse("invalid request");
        log.info("[REST] invalid request: {}", message);
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", message, false));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        log.info("[REST] bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage(), false));
    }

    static HttpStatus statusFor(ReasonCode reason) {
        if (reason == ReasonCode.STACK_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        if (reason.failureClass() == FailureClass.FIX_INPUT) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.CONFLICT;
    }
}
