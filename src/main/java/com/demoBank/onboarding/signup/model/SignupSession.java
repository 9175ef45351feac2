package com.demoBank.onboarding.signup.model;

import com.demoBank.onboarding.otp.model.OtpChallenge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * In-progress signup for one phone number.
 *
 * currentStep only moves forward; once completed the session is read-only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SignupSession {

    /**
     * Unique session ID (UUID).
     */
    private String sessionId;

    /**
     * Digits-only phone number.
     */
    private String phone;

    private String countryCode;

    /**
     * 1..5, see {@link SignupStep}.
     */
    private int currentStep;

    private StepData stepData;

    /**
     * Mobile OTP sub-state (step 1).
     */
    private OtpChallenge mobileOtp;

    private Instant mobileVerifiedAt;

    private boolean completed;

    private SignupCompletion completion;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isMobileVerified() {
        return mobileVerifiedAt != null;
    }

    /**
     * Moves to the given step unless the session is already past it.
     */
    public void advanceTo(SignupStep step) {
        this.currentStep = Math.max(this.currentStep, step.getNumber());
    }

    public boolean hasReached(SignupStep step) {
        return currentStep >= step.getNumber();
    }

    public SignupStep currentSignupStep() {
        return SignupStep.fromNumber(currentStep);
    }

    /**
     * Deep copy used as the working copy of a transaction.
     */
    public SignupSession copy() {
        return toBuilder()
                .stepData(stepData == null ? new StepData() : stepData.copy())
                .mobileOtp(mobileOtp == null ? null : mobileOtp.copy())
                .completion(completion == null ? null : completion.toBuilder().build())
                .build();
    }
}
