package com.demoBank.onboarding.account.model;

public enum AccountStatus {
    PENDING,
    APPROVED,
    REJECTED,
    FROZEN
}
