package com.demoBank.onboarding.account.exception;

/**
 * Thrown when bounded regeneration of a unique identifier runs out of attempts.
 */
public class IdentifierExhaustedException extends RuntimeException {

    public IdentifierExhaustedException(String message) {
        super(message);
    }
}
