package com.demoBank.onboarding.otp.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * Produces numeric one-time codes and their expiry timestamps.
 */
@Service
public class OtpGenerator {

    private final SecureRandom random = new SecureRandom();
    private final int defaultLength;
    private final long defaultTtlSeconds;

    public OtpGenerator(@Value("${onboarding.otp.length:6}") int defaultLength,
                        @Value("${onboarding.otp.ttl-seconds:300}") long defaultTtlSeconds) {
        if (defaultLength < 4 || defaultLength > 10) {
            throw new IllegalArgumentException("OTP length must be between 4 and 10, got " + defaultLength);
        }
        this.defaultLength = defaultLength;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public String issue() {
        return issue(defaultLength);
    }

    /**
     * Uniformly random numeric code; leading zeros are kept.
     */
    public String issue(int length) {
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(random.nextInt(10));
        }
        return code.toString();
    }

    public Instant expiryFrom(Instant now) {
        return expiryFrom(now, defaultTtlSeconds);
    }

    public Instant expiryFrom(Instant now, long ttlSeconds) {
        return now.plusSeconds(ttlSeconds);
    }

    public long getTtlSeconds() {
        return defaultTtlSeconds;
    }
}
