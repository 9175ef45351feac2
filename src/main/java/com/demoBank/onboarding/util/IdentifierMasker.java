package com.demoBank.onboarding.util;

/**
 * Utility class for masking phones, identifiers and handles (privacy compliance).
 */
public class IdentifierMasker {

    private static final char MASK_CHAR = 'X';

    private IdentifierMasker() {
    }

    /**
     * Masks a value for logging.
     * Shows first 2 and last 2 characters, masks the middle.
     *
     * @param value The value to mask (phone, session id, handle)
     * @return Masked value (e.g., "98****10")
     */
    public static String mask(String value) {
        if (value == null || value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 2) + "****" + value.substring(value.length() - 2);
    }

    /**
     * Builds the display-safe form of an identifier from its last 4 characters.
     *
     * @param last4 Last 4 characters of the identifier
     * @param totalLength Length of the full identifier
     * @return e.g. "XXXXXXXX1234" for a 12 character identifier
     */
    public static String maskKeepingLast4(String last4, int totalLength) {
        if (last4 == null) {
            return String.valueOf(MASK_CHAR).repeat(Math.max(totalLength, 4));
        }
        int hidden = Math.max(0, totalLength - last4.length());
        return String.valueOf(MASK_CHAR).repeat(hidden) + last4;
    }

    /**
     * Formats a phone number for display.
     *
     * @param phone Digits-only phone number
     * @param countryCode Country code such as "+91"
     * @return e.g. "+91 98765 43210"
     */
    public static String formatPhone(String phone, String countryCode) {
        if (phone == null) {
            return countryCode;
        }
        if (phone.length() == 10) {
            return countryCode + " " + phone.substring(0, 5) + " " + phone.substring(5);
        }
        return countryCode + " " + phone;
    }
}
