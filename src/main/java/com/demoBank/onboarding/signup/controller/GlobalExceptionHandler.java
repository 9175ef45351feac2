package com.demoBank.onboarding.signup.controller;

import com.demoBank.onboarding.account.exception.DuplicateAccountKeyException;
import com.demoBank.onboarding.account.exception.IdentifierExhaustedException;
import com.demoBank.onboarding.signup.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler. Business failures never get here; they are returned
 * as results by the services. This covers malformed requests and infrastructure faults.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("Validation error: {}", fieldErrors);
        ErrorResponse body = ErrorResponse.of("VALIDATION_ERROR", "VALIDATION", "Submitted data is invalid");
        body.setFieldErrors(fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("VALIDATION_ERROR", "VALIDATION", "Request body is malformed"));
    }

    @ExceptionHandler(IdentifierExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleIdentifierExhausted(IdentifierExhaustedException ex) {
        log.error("Identifier space exhausted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of("IDENTIFIER_EXHAUSTED", "INTERNAL", "Account could not be created. Please try again later."));
    }

    @ExceptionHandler(DuplicateAccountKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateAccountKeyException ex) {
        log.error("Duplicate account key - key: {}, message: {}", ex.getKey(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("DUPLICATE_ACCOUNT", "PRECONDITION", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "INTERNAL", "An unexpected error occurred"));
    }
}
