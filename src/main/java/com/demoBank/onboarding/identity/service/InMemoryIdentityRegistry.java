package com.demoBank.onboarding.identity.service;

import com.demoBank.onboarding.identity.model.IdentityClaims;
import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.identity.model.IdentityRecord;
import com.demoBank.onboarding.identity.model.IdentitySeedRecord;
import com.demoBank.onboarding.identity.model.MatchResult;
import com.demoBank.onboarding.identity.model.PrimaryIdRecord;
import com.demoBank.onboarding.identity.model.SecondaryIdRecord;
import com.demoBank.onboarding.identity.util.IdentifierHasher;
import com.demoBank.onboarding.util.JsonFileLoader;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identity registry held in memory and seeded from classpath JSON files.
 *
 * Records are keyed by the SHA-256 hash of the normalized identifier; the identifier itself is dropped on load.
 */
@Slf4j
@Service
public class InMemoryIdentityRegistry implements IdentityRegistry {

    private static final String SEED_CREATOR = "seed_file";

    private final Clock clock;
    private final String primarySeedPath;
    private final String secondarySeedPath;

    private final Map<IdentityKind, Map<String, IdentityRecord>> recordsByKind = new EnumMap<>(IdentityKind.class);

    public InMemoryIdentityRegistry(Clock clock,
                                    @Value("${onboarding.identity.primary-records:data/primary-id-records.json}") String primarySeedPath,
                                    @Value("${onboarding.identity.secondary-records:data/secondary-id-records.json}") String secondarySeedPath) {
        this.clock = clock;
        this.primarySeedPath = primarySeedPath;
        this.secondarySeedPath = secondarySeedPath;
        for (IdentityKind kind : IdentityKind.values()) {
            recordsByKind.put(kind, new ConcurrentHashMap<>());
        }
    }

    /**
     * Loads the seed files. Missing files leave the registry empty.
     */
    @PostConstruct
    public void loadSeedRecords() {
        int primary = seed(IdentityKind.PRIMARY, JsonFileLoader.loadAsListOrEmpty(primarySeedPath, IdentitySeedRecord.class));
        int secondary = seed(IdentityKind.SECONDARY, JsonFileLoader.loadAsListOrEmpty(secondarySeedPath, IdentitySeedRecord.class));
        log.info("Identity registry loaded - primaryRecords: {}, secondaryRecords: {}", primary, secondary);
    }

    private int seed(IdentityKind kind, List<IdentitySeedRecord> seeds) {
        int created = 0;
        for (IdentitySeedRecord seed : seeds) {
            try {
                register(kind, seed, SEED_CREATOR);
                created++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipped seed record - kind: {}, reason: {}", kind, e.getMessage());
            }
        }
        return created;
    }

    /**
     * Adds a record. The identifier is validated, hashed and discarded.
     *
     * @return the stored record
     * @throws IllegalArgumentException if the identifier is malformed or already registered
     */
    public IdentityRecord register(IdentityKind kind, IdentitySeedRecord seed, String createdBy) {
        String normalized = kind.normalize(seed.getIdentifier());
        if (!kind.isValidFormat(normalized)) {
            throw new IllegalArgumentException("Malformed " + kind.getProviderTag() + " identifier");
        }
        String idHash = IdentifierHasher.hash(normalized);
        String last4 = normalized.substring(normalized.length() - 4);
        Instant now = clock.instant();

        IdentityRecord record = switch (kind) {
            case PRIMARY -> PrimaryIdRecord.builder()
                    .idHash(idHash)
                    .last4(last4)
                    .fullName(seed.getFullName())
                    .dateOfBirth(seed.getDateOfBirth())
                    .gender(seed.getGender())
                    .address(seed.getAddress())
                    .postalCode(seed.getPostalCode())
                    .active(seed.isActiveOrDefault())
                    .createdBy(createdBy)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            case SECONDARY -> SecondaryIdRecord.builder()
                    .idHash(idHash)
                    .last4(last4)
                    .fullName(seed.getFullName())
                    .dateOfBirth(seed.getDateOfBirth())
                    .fatherName(seed.getFatherName())
                    .status(seed.getStatus() != null ? seed.getStatus() : "active")
                    .active(seed.isActiveOrDefault())
                    .createdBy(createdBy)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        };

        IdentityRecord existing = recordsByKind.get(kind).putIfAbsent(idHash, record);
        if (existing != null) {
            throw new IllegalArgumentException("Identifier ending in " + last4 + " is already registered");
        }
        log.debug("Registered identity record - kind: {}, last4: {}", kind, last4);
        return record;
    }

    /**
     * Marks a record inactive; lookups then treat it as not found.
     *
     * @return true if a record was deactivated
     */
    public boolean deactivate(IdentityKind kind, String rawIdentifier) {
        String idHash = IdentifierHasher.hash(kind.normalize(rawIdentifier));
        IdentityRecord updated = recordsByKind.get(kind).computeIfPresent(idHash, (key, record) -> {
            Instant now = clock.instant();
            if (record instanceof PrimaryIdRecord primary) {
                primary.setActive(false);
                primary.setUpdatedAt(now);
            } else if (record instanceof SecondaryIdRecord secondary) {
                secondary.setActive(false);
                secondary.setUpdatedAt(now);
            }
            return record;
        });
        return updated != null;
    }

    @Override
    public Optional<IdentityRecord> lookupByIdentifier(IdentityKind kind, String rawIdentifier) {
        String normalized = kind.normalize(rawIdentifier);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        IdentityRecord record = recordsByKind.get(kind).get(IdentifierHasher.hash(normalized));
        if (record == null || !record.isActive()) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public MatchResult crossCheck(IdentityRecord record, IdentityClaims claims) {
        List<String> mismatched = new ArrayList<>();
        if (!namesMatch(record.getFullName(), claims.fullName())) {
            mismatched.add(MatchResult.FULL_NAME);
        }
        if (!Objects.equals(record.getDateOfBirth(), claims.dateOfBirth())) {
            mismatched.add(MatchResult.DATE_OF_BIRTH);
        }
        if (record instanceof PrimaryIdRecord primary
                && !Objects.equals(normalizeGender(primary.getGender()), normalizeGender(claims.gender()))) {
            mismatched.add(MatchResult.GENDER);
        }
        return mismatched.isEmpty() ? MatchResult.match() : new MatchResult(mismatched);
    }

    public int size(IdentityKind kind) {
        return recordsByKind.get(kind).size();
    }

    private static boolean namesMatch(String recorded, String claimed) {
        if (recorded == null || claimed == null) {
            return false;
        }
        return recorded.trim().equalsIgnoreCase(claimed.trim());
    }

    private static String normalizeGender(String gender) {
        return gender == null ? null : gender.trim().toUpperCase();
    }
}
