package com.demoBank.onboarding.signup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OtpIssuedResponse {

    private String sessionId;
    private long expiresInSeconds;

    /**
     * Display form of the destination, e.g. "+91 98765 43210".
     */
    private String sentTo;
}
