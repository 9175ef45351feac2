package com.demoBank.onboarding.signup.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OtpCodeRequest {

    @NotBlank(message = "code is required")
    private String code;
}
