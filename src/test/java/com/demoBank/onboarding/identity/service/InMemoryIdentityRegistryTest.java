package com.demoBank.onboarding.identity.service;

import com.demoBank.onboarding.identity.model.IdentityClaims;
import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.identity.model.IdentityRecord;
import com.demoBank.onboarding.identity.model.IdentitySeedRecord;
import com.demoBank.onboarding.identity.model.MatchResult;
import com.demoBank.onboarding.identity.util.IdentifierHasher;
import com.demoBank.onboarding.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryIdentityRegistry")
class InMemoryIdentityRegistryTest {

    private static final LocalDate JOHN_DOB = LocalDate.of(1990, 1, 15);

    private InMemoryIdentityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryIdentityRegistry(new MutableClock(Instant.parse("2026-01-10T10:00:00Z")),
                "data/primary-id-records.json", "data/secondary-id-records.json");
        registry.loadSeedRecords();
    }

    @Test
    @DisplayName("Should load the seed files and keep only hashes of the identifiers")
    void shouldLoadSeedRecords() {
        assertThat(registry.size(IdentityKind.PRIMARY)).isEqualTo(3);
        assertThat(registry.size(IdentityKind.SECONDARY)).isEqualTo(3);

        IdentityRecord record = registry.lookupByIdentifier(IdentityKind.PRIMARY, "1234-5678-9012").orElseThrow();
        assertThat(record.getIdHash()).isEqualTo(IdentifierHasher.hash("123456789012")).hasSize(64);
        assertThat(record.getLast4()).isEqualTo("9012");
        assertThat(record.getFullName()).isEqualTo("John Doe");
        assertThat(record.getCreatedBy()).isEqualTo("seed_file");
    }

    @Test
    @DisplayName("Should normalize secondary identifiers to upper case")
    void shouldNormalizeSecondaryIdentifier() {
        assertThat(registry.lookupByIdentifier(IdentityKind.SECONDARY, " abcde1234f ")).isPresent();
        assertThat(registry.lookupByIdentifier(IdentityKind.SECONDARY, "ZZZZZ9999Z")).isEmpty();
        assertThat(registry.lookupByIdentifier(IdentityKind.SECONDARY, null)).isEmpty();
    }

    @Test
    @DisplayName("Should match names case-insensitively and ignore surrounding spaces")
    void shouldMatchClaims() {
        IdentityRecord record = registry.lookupByIdentifier(IdentityKind.PRIMARY, "123456789012").orElseThrow();

        MatchResult result = registry.crossCheck(record, new IdentityClaims("  john DOE ", JOHN_DOB, "m"));

        assertThat(result.isMatch()).isTrue();
    }

    @Test
    @DisplayName("Should flag a different name")
    void shouldFlagName() {
        IdentityRecord record = registry.lookupByIdentifier(IdentityKind.PRIMARY, "123456789012").orElseThrow();

        assertThat(registry.crossCheck(record, new IdentityClaims("Jon Doe", JOHN_DOB, "M")).mismatchedFields())
                .containsExactly(MatchResult.FULL_NAME);
    }

    @Test
    @DisplayName("Should flag a different date of birth")
    void shouldFlagDateOfBirth() {
        IdentityRecord record = registry.lookupByIdentifier(IdentityKind.PRIMARY, "123456789012").orElseThrow();

        assertThat(registry.crossCheck(record, new IdentityClaims("John Doe", JOHN_DOB.plusDays(1), "M")).mismatchedFields())
                .containsExactly(MatchResult.DATE_OF_BIRTH);
    }

    @Test
    @DisplayName("Should flag a different gender on the primary record only")
    void shouldFlagGenderOnPrimaryOnly() {
        IdentityRecord primary = registry.lookupByIdentifier(IdentityKind.PRIMARY, "123456789012").orElseThrow();
        IdentityRecord secondary = registry.lookupByIdentifier(IdentityKind.SECONDARY, "ABCDE1234F").orElseThrow();
        IdentityClaims claims = new IdentityClaims("John Doe", JOHN_DOB, "F");

        assertThat(registry.crossCheck(primary, claims).mismatchedFields()).containsExactly(MatchResult.GENDER);
        assertThat(registry.crossCheck(secondary, claims).isMatch()).isTrue();
    }

    @Test
    @DisplayName("Should hide deactivated records from lookups")
    void shouldHideInactiveRecords() {
        assertThat(registry.deactivate(IdentityKind.PRIMARY, "555666777888")).isTrue();

        assertThat(registry.lookupByIdentifier(IdentityKind.PRIMARY, "555666777888")).isEmpty();
        assertThat(registry.deactivate(IdentityKind.PRIMARY, "000000000000")).isFalse();
    }

    @Test
    @DisplayName("Should register new records and refuse duplicates or malformed identifiers")
    void shouldRegisterRecords() {
        IdentitySeedRecord seed = IdentitySeedRecord.builder()
                .identifier("111122223333")
                .fullName("Asha Rao")
                .dateOfBirth(LocalDate.of(1995, 6, 1))
                .gender("F")
                .address("Pune")
                .build();

        IdentityRecord record = registry.register(IdentityKind.PRIMARY, seed, "admin");

        assertThat(record.isActive()).isTrue();
        assertThat(record.getCreatedBy()).isEqualTo("admin");
        assertThat(registry.lookupByIdentifier(IdentityKind.PRIMARY, "111122223333")).isPresent();
        assertThatThrownBy(() -> registry.register(IdentityKind.PRIMARY, seed, "admin"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(IdentityKind.PRIMARY,
                IdentitySeedRecord.builder().identifier("12ab").fullName("Asha Rao").build(), "admin"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should start empty when seed files are missing")
    void shouldTolerateMissingSeedFiles() {
        InMemoryIdentityRegistry empty = new InMemoryIdentityRegistry(
                new MutableClock(Instant.parse("2026-01-10T10:00:00Z")), "data/missing.json", "data/missing.json");

        empty.loadSeedRecords();

        assertThat(empty.size(IdentityKind.PRIMARY)).isZero();
    }
}
