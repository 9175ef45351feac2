package com.demoBank.onboarding.otp.model;

/**
 * What an issued OTP confirms.
 */
public enum OtpPurpose {
    MOBILE_VERIFICATION("mobile verification"),
    PRIMARY_ID_VERIFICATION("primary ID verification"),
    SECONDARY_ID_VERIFICATION("secondary ID verification");

    private final String label;

    OtpPurpose(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
