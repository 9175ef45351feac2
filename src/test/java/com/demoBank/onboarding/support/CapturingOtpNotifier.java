package com.demoBank.onboarding.support;

import com.demoBank.onboarding.otp.model.OtpPurpose;
import com.demoBank.onboarding.otp.service.OtpNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every OTP "sent" so tests can read the codes back.
 */
public class CapturingOtpNotifier implements OtpNotifier {

    public record SentOtp(String phone, String countryCode, String code, OtpPurpose purpose) {
    }

    private final List<SentOtp> sent = new CopyOnWriteArrayList<>();

    @Override
    public void send(String phone, String countryCode, String code, OtpPurpose purpose) {
        sent.add(new SentOtp(phone, countryCode, code, purpose));
    }

    public String lastCode(OtpPurpose purpose) {
        for (int i = sent.size() - 1; i >= 0; i--) {
            if (sent.get(i).purpose() == purpose) {
                return sent.get(i).code();
            }
        }
        throw new AssertionError("No OTP sent for " + purpose);
    }

    public List<SentOtp> getSent() {
        return List.copyOf(sent);
    }
}
