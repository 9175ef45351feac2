package com.demoBank.onboarding.signup.model;

/**
 * Coarse failure categories of a step transition.
 * Every {@link SignupErrorCode} belongs to exactly one kind.
 */
public enum ErrorKind {
    VALIDATION,
    PRECONDITION,
    NOT_FOUND,
    RATE_LIMITED,
    IDENTITY_MISMATCH,
    AUTHENTICATION
}
