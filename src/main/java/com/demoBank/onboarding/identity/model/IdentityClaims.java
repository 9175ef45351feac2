package com.demoBank.onboarding.identity.model;

import java.time.LocalDate;

/**
 * User-supplied details to cross-check against a record.
 *
 * @param gender null when the document carries no gender
 */
public record IdentityClaims(String fullName, LocalDate dateOfBirth, String gender) {
}
