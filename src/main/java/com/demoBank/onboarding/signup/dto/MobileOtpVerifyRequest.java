package com.demoBank.onboarding.signup.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MobileOtpVerifyRequest {

    @NotBlank(message = "sessionId is required")
    private String sessionId;

    @NotBlank(message = "code is required")
    private String code;
}
