package com.demoBank.onboarding.account.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Permanent customer created by a completed signup.
 * Identity documents are stored masked only; the PIN only as a hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class UserAccount {

    /**
     * Unique login handle, e.g. "jd3210".
     */
    private String handle;

    /**
     * Unique 5-digit customer identifier.
     */
    private int customerId;

    private String phone;
    private String countryCode;
    private boolean phoneVerified;
    private String email;

    private String fullName;
    private LocalDate dateOfBirth;
    private String gender;
    private String address;

    private String maskedPrimaryId;
    private String maskedSecondaryId;

    /**
     * Registry hashes of the verified documents; one account per document.
     */
    private String primaryIdHash;
    private String secondaryIdHash;

    private AccountStatus accountStatus;
    private int creditScore;
    private Instant approvedAt;

    private String pinHash;
    private Instant pinSetAt;
    private int pinAttempts;
    private Instant pinLockedUntil;

    private Instant termsAcceptedAt;
    private Instant createdAt;

    public UserAccount copy() {
        return toBuilder().build();
    }
}
