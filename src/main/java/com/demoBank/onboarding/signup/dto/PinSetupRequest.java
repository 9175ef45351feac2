package com.demoBank.onboarding.signup.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PinSetupRequest {

    @NotBlank(message = "pin is required")
    private String pin;

    @NotBlank(message = "confirmPin is required")
    private String confirmPin;

    private boolean termsAccepted;
}
