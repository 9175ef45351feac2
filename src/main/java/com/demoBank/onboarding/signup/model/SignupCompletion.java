package com.demoBank.onboarding.signup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Terminal metadata stored on a completed session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SignupCompletion {

    private String accountHandle;
    private String accountNumber;
    private int customerId;
    private Instant termsAcceptedAt;
    private Instant completedAt;
}
