package com.demoBank.onboarding.identity.service;

import com.demoBank.onboarding.identity.model.IdentityClaims;
import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.identity.model.IdentityRecord;
import com.demoBank.onboarding.identity.model.MatchResult;

import java.util.Optional;

/**
 * Read-only lookup of pre-approved identity records.
 * A real registry integration replaces the in-memory implementation behind this interface.
 */
public interface IdentityRegistry {

    /**
     * Finds the active record for an identifier. Inactive records are never returned.
     *
     * @param kind Document kind
     * @param rawIdentifier Identifier as entered by the user
     * @return Active record, or empty if unknown or inactive
     */
    Optional<IdentityRecord> lookupByIdentifier(IdentityKind kind, String rawIdentifier);

    /**
     * Compares claims with a record: case-insensitive name, exact date of birth,
     * and exact gender for primary records.
     */
    MatchResult crossCheck(IdentityRecord record, IdentityClaims claims);
}
