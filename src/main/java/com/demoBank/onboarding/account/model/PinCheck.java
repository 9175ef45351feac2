package com.demoBank.onboarding.account.model;

public enum PinCheck {
    OK,
    LOCKED,
    WRONG_FORMAT,
    NO_PIN_SET,
    WRONG
}
