package com.demoBank.onboarding.identity.model;

import java.util.List;

/**
 * Result of a cross-check. Lists every field that differed, in check order.
 */
public record MatchResult(List<String> mismatchedFields) {

    public static final String FULL_NAME = "fullName";
    public static final String DATE_OF_BIRTH = "dateOfBirth";
    public static final String GENDER = "gender";

    public MatchResult {
        mismatchedFields = List.copyOf(mismatchedFields);
    }

    public static MatchResult match() {
        return new MatchResult(List.of());
    }

    public boolean isMatch() {
        return mismatchedFields.isEmpty();
    }
}
