package com.demoBank.onboarding.signup.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SignupInputValidator")
class SignupInputValidatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 10);

    @Test
    @DisplayName("Should strip formatting and bound the digit count")
    void shouldNormalizePhone() {
        assertThat(SignupInputValidator.normalizePhone("(987) 654-3210")).isEqualTo("9876543210");
        assertThat(SignupInputValidator.normalizePhone("1234567")).isNull();
        assertThat(SignupInputValidator.normalizePhone("1234567890123456")).isNull();
        assertThat(SignupInputValidator.normalizePhone(null)).isNull();
    }

    @Test
    @DisplayName("Should default the country code and reject malformed ones")
    void shouldNormalizeCountryCode() {
        assertThat(SignupInputValidator.normalizeCountryCode(null)).isEqualTo("+91");
        assertThat(SignupInputValidator.normalizeCountryCode(" +44 ")).isEqualTo("+44");
        assertThat(SignupInputValidator.normalizeCountryCode("91")).isNull();
    }

    @Test
    @DisplayName("Should accept an adult exactly 18 today")
    void shouldAcceptEighteenToday() {
        Map<String, String> errors = SignupInputValidator.validatePersonalDetails(
                "John Doe", "john@example.com", TODAY.minusYears(18), "M", TODAY);

        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Should reject a date of birth one day short of 18 or in the future")
    void shouldRejectMinorsAndFutureDates() {
        assertThat(SignupInputValidator.validatePersonalDetails(
                "John Doe", "john@example.com", TODAY.minusYears(18).plusDays(1), "M", TODAY))
                .containsOnlyKeys("dateOfBirth");
        assertThat(SignupInputValidator.validatePersonalDetails(
                "John Doe", "john@example.com", TODAY.plusDays(1), "M", TODAY))
                .containsEntry("dateOfBirth", "Date of birth cannot be in the future");
    }

    @ParameterizedTest
    @ValueSource(strings = {"123456", "000000", "111111", "654321", "234567", "987654", "890123"})
    @DisplayName("Should flag trivial PINs")
    void shouldFlagTrivialPins(String pin) {
        assertThat(SignupInputValidator.isTrivialPin(pin)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"482917", "135790", "102938"})
    @DisplayName("Should accept non-trivial PINs")
    void shouldAcceptOtherPins(String pin) {
        assertThat(SignupInputValidator.validatePin(pin, pin, true)).isEmpty();
    }
}
