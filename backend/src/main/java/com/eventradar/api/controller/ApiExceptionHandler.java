package com.eventradar.api.controller;

import com.eventradar.api.dto.ErrorBody;
import com.eventradar.scheduler.SchedulerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps scheduler rejections and request validation failures to HTTP status codes with ErrorBody.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SchedulerException.class)
    public ResponseEntity<ErrorBody> handleScheduler(SchedulerException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case ALREADY_SCHEDULED -> HttpStatus.CONFLICT;
            case MAX_WORKERS_REACHED -> HttpStatus.TOO_MANY_REQUESTS;
            case UNSUPPORTED_CHAIN, INVALID_CONTRACT_ADDRESS, INVALID_TRIGGER_EVENT -> HttpStatus.BAD_REQUEST;
            case JOB_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SCHEDULER_STOPPED, CHAIN_UNAVAILABLE, WORKER_START_FAILED, NO_CHAINS_CONNECTED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getReason().name(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(ApiExceptionHandler::describe)
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleBadInput(ServerWebInputException ex) {
        log.debug("Rejected request input: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason() != null ? ex.getReason() : "Invalid request"));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
