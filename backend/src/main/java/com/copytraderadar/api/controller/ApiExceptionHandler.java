package com.copytraderadar.api.controller;

import com.copytraderadar.api.dto.ErrorBody;
import com.copytraderadar.copytrade.CopyTradeConfigException;
import com.copytraderadar.copytrade.CopyTradeEventException;
import com.copytraderadar.ingestion.webhook.WebhookAuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Maps failures to ErrorBody (error, message, timestamp). Callers never see a stack trace.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<ErrorBody> handleWebhookAuthentication(WebhookAuthenticationException ex) {
        log.warn("Webhook rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorBody.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(CopyTradeConfigException.class)
    public ResponseEntity<ErrorBody> handleConfig(CopyTradeConfigException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case DUPLICATE_CONFIG, CONCURRENT_UPDATE -> HttpStatus.CONFLICT;
            case CONFIG_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_CONFIG -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(CopyTradeEventException.class)
    public ResponseEntity<ErrorBody> handleEvent(CopyTradeEventException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case EVENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> handleStatus(ResponseStatusException ex) {
        String reason = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(ErrorBody.of("REQUEST_ERROR", reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnexpected(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("INTERNAL_ERROR", "Request could not be processed"));
    }
}
