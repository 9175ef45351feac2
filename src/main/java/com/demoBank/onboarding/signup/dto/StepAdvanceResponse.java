package com.demoBank.onboarding.signup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StepAdvanceResponse {

    private String sessionId;
    private int nextStep;

    /**
     * Set by the ID verification steps only.
     */
    private String maskedIdentifier;
}
