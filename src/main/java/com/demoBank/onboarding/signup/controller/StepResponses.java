package com.demoBank.onboarding.signup.controller;

import com.demoBank.onboarding.signup.dto.ErrorResponse;
import com.demoBank.onboarding.signup.model.ErrorKind;
import com.demoBank.onboarding.signup.model.SignupError;
import com.demoBank.onboarding.signup.model.StepResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps step results onto HTTP responses.
 */
public final class StepResponses {

    private StepResponses() {
    }

    public static ResponseEntity<?> toResponse(StepResult<?> result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result.getValue());
        }
        SignupError error = result.getError();
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusFor(error.getKind()));
        if (error.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(error.getRetryAfterSeconds()));
        }
        return builder.body(ErrorResponse.from(error));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case PRECONDITION -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case IDENTITY_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
        };
    }
}
