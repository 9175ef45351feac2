package com.demoBank.onboarding.otp.service;

import com.demoBank.onboarding.otp.model.OtpPurpose;
import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Development notifier - writes the code to the application log instead of sending an SMS.
 */
@Slf4j
@Service
public class ConsoleOtpNotifier implements OtpNotifier {

    @Override
    public void send(String phone, String countryCode, String code, OtpPurpose purpose) {
        log.info("SMS SENT ({}) - to: {}, otp: {}",
                purpose.getLabel(), IdentifierMasker.formatPhone(phone, countryCode), code);
    }
}
