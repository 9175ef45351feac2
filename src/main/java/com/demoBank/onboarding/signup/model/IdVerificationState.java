package com.demoBank.onboarding.signup.model;

public enum IdVerificationState {
    OTP_SENT,
    VERIFIED
}
