package com.demoBank.onboarding.signup.dto;

import com.demoBank.onboarding.signup.model.SignupError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorResponse {

    private String code;
    private String kind;
    private String message;
    private Map<String, String> fieldErrors;
    private Integer attemptsLeft;
    private List<String> mismatchedFields;
    private Long retryAfterSeconds;

    public static ErrorResponse from(SignupError error) {
        return ErrorResponse.builder()
                .code(error.getCode().name())
                .kind(error.getKind().name())
                .message(error.getMessage())
                .fieldErrors(error.getFieldErrors())
                .attemptsLeft(error.getAttemptsLeft())
                .mismatchedFields(error.getMismatchedFields())
                .retryAfterSeconds(error.getRetryAfterSeconds())
                .build();
    }

    public static ErrorResponse of(String code, String kind, String message) {
        return ErrorResponse.builder()
                .code(code)
                .kind(kind)
                .message(message)
                .build();
    }
}
