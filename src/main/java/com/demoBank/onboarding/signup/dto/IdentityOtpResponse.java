package com.demoBank.onboarding.signup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IdentityOtpResponse {

    private String maskedIdentifier;

    /**
     * Name on the registry record.
     */
    private String holderName;

    private long expiresInSeconds;
}
