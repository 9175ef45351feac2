package com.demoBank.onboarding.signup.model;

import java.util.Arrays;

/**
 * The five gated signup steps, in order.
 */
public enum SignupStep {
    MOBILE(1, "Mobile Verification"),
    PERSONAL_DETAILS(2, "Personal Details"),
    PRIMARY_ID(3, "Primary ID Verification"),
    SECONDARY_ID(4, "Secondary ID Verification"),
    PIN_SETUP(5, "PIN Setup");

    private final int number;
    private final String displayName;

    SignupStep(int number, String displayName) {
        this.number = number;
        this.displayName = displayName;
    }

    public int getNumber() {
        return number;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static SignupStep fromNumber(int number) {
        return Arrays.stream(values())
                .filter(step -> step.number == number)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown signup step: " + number));
    }
}
