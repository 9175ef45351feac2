package com.demoBank.onboarding.otp.service;

import com.demoBank.onboarding.otp.model.OtpPurpose;

/**
 * Delivery channel for issued codes (SMS gateway in production).
 * Fire-and-forget: implementations must not throw back into the signup flow.
 */
public interface OtpNotifier {

    void send(String phone, String countryCode, String code, OtpPurpose purpose);
}
