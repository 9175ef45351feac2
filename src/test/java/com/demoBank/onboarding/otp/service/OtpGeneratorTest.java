package com.demoBank.onboarding.otp.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OtpGenerator")
class OtpGeneratorTest {

    private final OtpGenerator generator = new OtpGenerator(6, 300);

    @Test
    @DisplayName("Should produce numeric codes of the configured length")
    void shouldIssueNumericCodes() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            String code = generator.issue();
            assertThat(code).hasSize(6).containsOnlyDigits();
            codes.add(code);
        }
        assertThat(codes).hasSizeGreaterThan(150);
    }

    @Test
    @DisplayName("Should honour an explicit length")
    void shouldIssueRequestedLength() {
        assertThat(generator.issue(8)).hasSize(8).containsOnlyDigits();
    }

    @Test
    @DisplayName("Should compute expiry from the configured lifetime")
    void shouldComputeExpiry() {
        Instant now = Instant.parse("2026-01-10T10:00:00Z");

        assertThat(generator.expiryFrom(now)).isEqualTo(now.plusSeconds(300));
        assertThat(generator.getTtlSeconds()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should refuse lengths outside 4..10")
    void shouldRejectBadLength() {
        assertThatThrownBy(() -> new OtpGenerator(3, 300)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OtpGenerator(11, 300)).isInstanceOf(IllegalArgumentException.class);
    }
}
