package com.demoBank.onboarding.signup.service;

import java.time.LocalDate;
import java.time.Period;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field-level validation of step input. Returns field name to message; an empty map means valid.
 */
public class SignupInputValidator {

    public static final String DEFAULT_COUNTRY_CODE = "+91";

    private static final int MIN_PHONE_DIGITS = 8;
    private static final int MAX_PHONE_DIGITS = 15;
    private static final Pattern COUNTRY_CODE = Pattern.compile("^\\+\\d{1,4}$");
    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$");
    private static final Pattern PIN = Pattern.compile("^\\d{6}$");
    private static final Set<String> GENDERS = Set.of("M", "F", "O");
    private static final Set<String> COMMON_PINS = Set.of("123456", "654321", "000000", "111111", "121212", "112233");

    private static final int MIN_NAME_LENGTH = 2;
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MIN_AGE = 18;
    private static final int MAX_AGE = 120;

    private SignupInputValidator() {
    }

    /**
     * Strips formatting from a phone number.
     *
     * @return digits only, or null if the number does not have 8 to 15 digits
     */
    public static String normalizePhone(String rawPhone) {
        if (rawPhone == null) {
            return null;
        }
        String digits = rawPhone.chars()
                .filter(Character::isDigit)
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString();
        if (digits.length() < MIN_PHONE_DIGITS || digits.length() > MAX_PHONE_DIGITS) {
            return null;
        }
        return digits;
    }

    /**
     * @return the country code to store, or null if malformed
     */
    public static String normalizeCountryCode(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return DEFAULT_COUNTRY_CODE;
        }
        String trimmed = countryCode.trim();
        return COUNTRY_CODE.matcher(trimmed).matches() ? trimmed : null;
    }

    public static Map<String, String> validatePersonalDetails(String fullName,
                                                              String email,
                                                              LocalDate dateOfBirth,
                                                              String gender,
                                                              LocalDate today) {
        Map<String, String> errors = new LinkedHashMap<>();

        String name = fullName == null ? "" : fullName.trim();
        if (name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
            errors.put("fullName", "Full name must be between 2 and 100 characters");
        }

        if (email == null || !EMAIL.matcher(email.trim()).matches()) {
            errors.put("email", "Enter a valid email address");
        }

        if (dateOfBirth == null) {
            errors.put("dateOfBirth", "Date of birth is required");
        } else if (dateOfBirth.isAfter(today)) {
            errors.put("dateOfBirth", "Date of birth cannot be in the future");
        } else {
            int age = Period.between(dateOfBirth, today).getYears();
            if (age < MIN_AGE) {
                errors.put("dateOfBirth", "You must be at least 18 years old to create an account");
            } else if (age > MAX_AGE) {
                errors.put("dateOfBirth", "Enter a valid date of birth");
            }
        }

        if (gender == null || !GENDERS.contains(gender.trim().toUpperCase())) {
            errors.put("gender", "Gender must be one of M, F, O");
        }
        return errors;
    }

    public static Map<String, String> validatePin(String pin, String confirmPin, boolean termsAccepted) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (!termsAccepted) {
            errors.put("termsAccepted", "Terms and conditions must be accepted");
        }
        if (pin == null || !PIN.matcher(pin).matches()) {
            errors.put("pin", "PIN must be exactly 6 digits");
            return errors;
        }
        if (!pin.equals(confirmPin)) {
            errors.put("confirmPin", "PINs do not match");
        } else if (isTrivialPin(pin)) {
            errors.put("pin", "Please choose a more secure PIN. Avoid common patterns.");
        }
        return errors;
    }

    /**
     * Common PINs, a single repeated digit, and straight ascending or descending runs.
     */
    static boolean isTrivialPin(String pin) {
        if (COMMON_PINS.contains(pin)) {
            return true;
        }
        boolean repeated = true;
        boolean ascending = true;
        boolean descending = true;
        for (int i = 1; i < pin.length(); i++) {
            int previous = pin.charAt(i - 1) - '0';
            int current = pin.charAt(i) - '0';
            repeated &= current == previous;
            ascending &= current == (previous + 1) % 10;
            descending &= current == (previous + 9) % 10;
        }
        return repeated || ascending || descending;
    }
}
