package com.demoBank.onboarding.identity.model;

import java.util.regex.Pattern;

/**
 * The two identity documents checked during signup.
 */
public enum IdentityKind {

    /**
     * 12-digit national ID (Aadhaar style). Spaces are allowed on input.
     */
    PRIMARY("primary_id", 12, Pattern.compile("^\\d{12}$")),

    /**
     * 10-character tax ID (PAN style): 5 letters, 4 digits, 1 letter.
     */
    SECONDARY("secondary_id", 10, Pattern.compile("^[A-Z]{5}[0-9]{4}[A-Z]$"));

    private final String providerTag;
    private final int identifierLength;
    private final Pattern format;

    IdentityKind(String providerTag, int identifierLength, Pattern format) {
        this.providerTag = providerTag;
        this.identifierLength = identifierLength;
        this.format = format;
    }

    public String getProviderTag() {
        return providerTag;
    }

    public int getIdentifierLength() {
        return identifierLength;
    }

    /**
     * Canonical form used for format checks and hashing.
     */
    public String normalize(String rawIdentifier) {
        if (rawIdentifier == null) {
            return "";
        }
        String trimmed = rawIdentifier.trim();
        return switch (this) {
            case PRIMARY -> trimmed.replaceAll("[\\s-]", "");
            case SECONDARY -> trimmed.toUpperCase();
        };
    }

    public boolean isValidFormat(String normalizedIdentifier) {
        return normalizedIdentifier != null && format.matcher(normalizedIdentifier).matches();
    }

    public String formatHint() {
        return switch (this) {
            case PRIMARY -> "Enter a valid 12-digit ID number";
            case SECONDARY -> "Enter a valid ID number (format: ABCDE1234F)";
        };
    }
}
