package com.demoBank.onboarding.account.model;

import java.time.Instant;

/**
 * Result of a PIN check.
 *
 * @param attemptsLeft wrong attempts left before lockout
 * @param lockedUntil end of the current lockout, null when not locked
 */
public record PinVerification(PinCheck outcome, int attemptsLeft, Instant lockedUntil) {

    public boolean isOk() {
        return outcome == PinCheck.OK;
    }
}
