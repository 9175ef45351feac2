package com.demoBank.onboarding.signup.model;

/**
 * Failure signals reported by the signup flow and the PIN login.
 */
public enum SignupErrorCode {
    INVALID_PHONE(ErrorKind.VALIDATION, "Please enter a valid phone number"),
    PHONE_ALREADY_REGISTERED(ErrorKind.VALIDATION, "An account already exists for this phone number"),
    EMAIL_ALREADY_REGISTERED(ErrorKind.VALIDATION, "An account already exists for this email address"),
    IDENTITY_ALREADY_REGISTERED(ErrorKind.VALIDATION, "An account already exists for this identity document"),
    VALIDATION_ERROR(ErrorKind.VALIDATION, "Submitted data is invalid"),

    SESSION_NOT_FOUND(ErrorKind.NOT_FOUND, "Invalid or expired session"),
    RECORD_NOT_FOUND(ErrorKind.NOT_FOUND, "No matching identity record was found"),
    ACCOUNT_NOT_FOUND(ErrorKind.NOT_FOUND, "No account found with this phone number"),

    SESSION_EXPIRED(ErrorKind.PRECONDITION, "Signup session has expired. Please start again."),
    SESSION_COMPLETED(ErrorKind.PRECONDITION, "Signup session is already completed"),
    PRECONDITION_NOT_MET(ErrorKind.PRECONDITION, "Previous steps must be completed first"),
    NOT_ALL_VERIFIED(ErrorKind.PRECONDITION, "All verifications must be completed before PIN setup"),
    NO_OTP(ErrorKind.PRECONDITION, "No OTP found. Please request a new one."),
    OTP_EXPIRED(ErrorKind.PRECONDITION, "OTP has expired. Please request a new one."),

    WRONG_OTP(ErrorKind.VALIDATION, "Invalid OTP. Please try again."),

    TOO_MANY_ATTEMPTS(ErrorKind.RATE_LIMITED, "Too many failed attempts. Please request a new OTP."),
    OTP_SEND_LIMIT(ErrorKind.RATE_LIMITED, "Too many OTP requests. Please try again later."),
    PIN_LOCKED(ErrorKind.RATE_LIMITED, "Too many wrong PIN attempts. Please try again later."),

    IDENTITY_MISMATCH(ErrorKind.IDENTITY_MISMATCH, "Submitted details do not match the identity record"),

    WRONG_PIN(ErrorKind.AUTHENTICATION, "Invalid PIN. Please try again."),
    NO_PIN_SET(ErrorKind.AUTHENTICATION, "No PIN has been set for this account");

    private final ErrorKind kind;
    private final String defaultMessage;

    SignupErrorCode(ErrorKind kind, String defaultMessage) {
        this.kind = kind;
        this.defaultMessage = defaultMessage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
