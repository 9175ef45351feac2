package com.demoBank.onboarding.otp.model;

public enum OtpCheckOutcome {
    VERIFIED,
    TOO_MANY_ATTEMPTS,
    NO_OTP,
    EXPIRED,
    WRONG
}
