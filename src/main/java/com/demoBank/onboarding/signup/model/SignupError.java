package com.demoBank.onboarding.signup.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured failure of a single transition.
 * Only the fields relevant to the code are populated.
 */
@Value
@Builder
public class SignupError {

    SignupErrorCode code;

    String message;

    /**
     * Field name to message, for {@link SignupErrorCode#VALIDATION_ERROR}.
     */
    Map<String, String> fieldErrors;

    /**
     * Remaining OTP or PIN attempts, where applicable.
     */
    Integer attemptsLeft;

    /**
     * Fields that differed from the identity record, for {@link SignupErrorCode#IDENTITY_MISMATCH}.
     */
    List<String> mismatchedFields;

    /**
     * Seconds until the caller may retry, for rate-limited failures.
     */
    Long retryAfterSeconds;

    public ErrorKind getKind() {
        return code.getKind();
    }

    public static SignupError of(SignupErrorCode code) {
        return SignupError.builder()
                .code(code)
                .message(code.getDefaultMessage())
                .build();
    }

    public static SignupError of(SignupErrorCode code, String message) {
        return SignupError.builder()
                .code(code)
                .message(message)
                .build();
    }

    public static SignupError validation(Map<String, String> fieldErrors) {
        return SignupError.builder()
                .code(SignupErrorCode.VALIDATION_ERROR)
                .message(SignupErrorCode.VALIDATION_ERROR.getDefaultMessage())
                .fieldErrors(Map.copyOf(fieldErrors))
                .build();
    }

    public static SignupError validation(String field, String message) {
        return validation(Map.of(field, message));
    }

    public static SignupError withAttemptsLeft(SignupErrorCode code, int attemptsLeft) {
        return SignupError.builder()
                .code(code)
                .message(code.getDefaultMessage())
                .attemptsLeft(Math.max(0, attemptsLeft))
                .build();
    }

    public static SignupError mismatch(List<String> fields) {
        return SignupError.builder()
                .code(SignupErrorCode.IDENTITY_MISMATCH)
                .message("Details do not match the identity record: " + String.join(", ", fields))
                .mismatchedFields(List.copyOf(fields))
                .build();
    }

    public static SignupError rateLimited(SignupErrorCode code, long retryAfterSeconds) {
        return SignupError.builder()
                .code(code)
                .message(code.getDefaultMessage())
                .retryAfterSeconds(Math.max(0, retryAfterSeconds))
                .build();
    }
}
