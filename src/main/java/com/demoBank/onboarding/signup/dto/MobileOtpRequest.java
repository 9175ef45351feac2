package com.demoBank.onboarding.signup.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MobileOtpRequest {

    @NotBlank(message = "phone is required")
    private String phone;

    /**
     * Optional, defaults to "+91".
     */
    private String countryCode;
}
