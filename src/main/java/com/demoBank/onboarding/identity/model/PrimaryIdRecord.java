package com.demoBank.onboarding.identity.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrimaryIdRecord implements IdentityRecord {

    private String idHash;
    private String last4;
    private String fullName;
    private LocalDate dateOfBirth;

    /**
     * "M", "F" or "O".
     */
    private String gender;

    private String address;
    private String postalCode;
    private boolean active;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public IdentityKind getKind() {
        return IdentityKind.PRIMARY;
    }
}
