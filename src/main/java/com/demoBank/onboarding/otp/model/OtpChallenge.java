package com.demoBank.onboarding.otp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * OTP sub-state of one verification: the pending code, its expiry and the wrong-attempt counter.
 *
 * The code is single-use: a successful {@link #check} clears it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OtpChallenge {

    /**
     * Pending code, null once consumed or before any was issued.
     */
    private String code;

    private Instant expiresAt;

    private int attempts;

    /**
     * Replaces any pending code with a fresh one and resets the attempt counter.
     */
    public void reissue(String newCode, Instant newExpiresAt) {
        this.code = newCode;
        this.expiresAt = newExpiresAt;
        this.attempts = 0;
    }

    public boolean hasPendingCode() {
        return code != null && expiresAt != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt == null || now.isAfter(expiresAt);
    }

    public int attemptsLeft(int maxAttempts) {
        return Math.max(0, maxAttempts - attempts);
    }

    /**
     * Checks a submitted code and updates this challenge accordingly.
     * Attempt exhaustion wins over everything else, including a correct code.
     *
     * @param submitted Code entered by the user
     * @param now Current time
     * @param maxAttempts Wrong attempts allowed per issued code
     * @return Outcome of the check
     */
    public OtpCheckOutcome check(String submitted, Instant now, int maxAttempts) {
        if (attempts >= maxAttempts) {
            return OtpCheckOutcome.TOO_MANY_ATTEMPTS;
        }
        if (!hasPendingCode()) {
            return OtpCheckOutcome.NO_OTP;
        }
        if (isExpired(now)) {
            return OtpCheckOutcome.EXPIRED;
        }
        if (submitted != null && MessageDigest.isEqual(
                code.getBytes(StandardCharsets.UTF_8), submitted.trim().getBytes(StandardCharsets.UTF_8))) {
            code = null;
            expiresAt = null;
            attempts = 0;
            return OtpCheckOutcome.VERIFIED;
        }
        attempts++;
        return OtpCheckOutcome.WRONG;
    }

    public OtpChallenge copy() {
        return new OtpChallenge(code, expiresAt, attempts);
    }
}
