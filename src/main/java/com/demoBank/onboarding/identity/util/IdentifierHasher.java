package com.demoBank.onboarding.identity.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way hash used as the registry key for identifiers.
 */
public class IdentifierHasher {

    private IdentifierHasher() {
    }

    /**
     * @param normalizedIdentifier Identifier in canonical form (see IdentityKind#normalize)
     * @return lowercase hex SHA-256 digest
     */
    public static String hash(String normalizedIdentifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(normalizedIdentifier.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
