package com.demoBank.onboarding.account.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "phone is required")
    private String phone;

    @NotBlank(message = "pin is required")
    private String pin;
}
