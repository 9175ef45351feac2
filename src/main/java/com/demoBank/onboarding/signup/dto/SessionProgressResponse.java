package com.demoBank.onboarding.signup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Where a signup stands, for resuming on another screen or device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionProgressResponse {

    private String sessionId;
    private int currentStep;
    private String stepName;
    private String phoneDisplay;
    private boolean mobileVerified;
    private boolean personalDetailsSaved;
    private boolean primaryIdVerified;
    private boolean secondaryIdVerified;
    private boolean completed;
    private Instant expiresAt;
}
