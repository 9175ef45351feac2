package com.demoBank.onboarding.otp.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OtpChallenge")
class OtpChallengeTest {

    private static final Instant NOW = Instant.parse("2026-01-10T10:00:00Z");

    private OtpChallenge pending(String code) {
        OtpChallenge challenge = new OtpChallenge();
        challenge.reissue(code, NOW.plusSeconds(300));
        return challenge;
    }

    @Test
    @DisplayName("Should verify the right code once and clear it")
    void shouldVerifyAndConsume() {
        OtpChallenge challenge = pending("123456");

        assertThat(challenge.check(" 123456 ", NOW, 3)).isEqualTo(OtpCheckOutcome.VERIFIED);
        assertThat(challenge.hasPendingCode()).isFalse();
        assertThat(challenge.check("123456", NOW, 3)).isEqualTo(OtpCheckOutcome.NO_OTP);
    }

    @Test
    @DisplayName("Should count wrong attempts and report exhaustion before comparing")
    void shouldExhaustAttempts() {
        OtpChallenge challenge = pending("123456");

        assertThat(challenge.check("000000", NOW, 3)).isEqualTo(OtpCheckOutcome.WRONG);
        assertThat(challenge.attemptsLeft(3)).isEqualTo(2);
        challenge.check("000000", NOW, 3);
        challenge.check(null, NOW, 3);

        assertThat(challenge.getAttempts()).isEqualTo(3);
        assertThat(challenge.check("123456", NOW, 3)).isEqualTo(OtpCheckOutcome.TOO_MANY_ATTEMPTS);
    }

    @Test
    @DisplayName("Should treat the expiry instant itself as still valid")
    void shouldExpireAfterDeadline() {
        OtpChallenge challenge = pending("123456");

        assertThat(challenge.check("000000", NOW.plusSeconds(300), 3)).isEqualTo(OtpCheckOutcome.WRONG);
        assertThat(challenge.check("123456", NOW.plusSeconds(301), 3)).isEqualTo(OtpCheckOutcome.EXPIRED);
    }

    @Test
    @DisplayName("Should reset the attempt counter on reissue")
    void shouldResetOnReissue() {
        OtpChallenge challenge = pending("123456");
        challenge.check("000000", NOW, 3);
        challenge.check("000000", NOW, 3);
        challenge.check("000000", NOW, 3);

        challenge.reissue("654321", NOW.plusSeconds(300));

        assertThat(challenge.getAttempts()).isZero();
        assertThat(challenge.check("123456", NOW, 3)).isEqualTo(OtpCheckOutcome.WRONG);
        assertThat(challenge.check("654321", NOW, 3)).isEqualTo(OtpCheckOutcome.VERIFIED);
    }

    @Test
    @DisplayName("Should report NO_OTP when nothing was issued")
    void shouldReportNoOtp() {
        assertThat(new OtpChallenge().check("123456", NOW, 3)).isEqualTo(OtpCheckOutcome.NO_OTP);
    }
}
