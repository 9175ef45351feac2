package com.demoBank.onboarding.identity.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Admin-curated identity record. Never carries the full identifier, only its hash and last 4 characters.
 */
public interface IdentityRecord {

    IdentityKind getKind();

    String getIdHash();

    String getLast4();

    String getFullName();

    LocalDate getDateOfBirth();

    boolean isActive();

    String getCreatedBy();

    Instant getCreatedAt();

    Instant getUpdatedAt();
}
