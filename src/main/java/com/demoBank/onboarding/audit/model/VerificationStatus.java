package com.demoBank.onboarding.audit.model;

public enum VerificationStatus {
    PENDING,
    SUCCESS,
    FAILED
}
