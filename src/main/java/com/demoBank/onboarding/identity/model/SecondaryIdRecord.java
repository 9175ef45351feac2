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
public class SecondaryIdRecord implements IdentityRecord {

    private String idHash;
    private String last4;
    private String fullName;
    private LocalDate dateOfBirth;
    private String fatherName;

    /**
     * Registry status of the document, e.g. "active".
     */
    private String status;

    private boolean active;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    @Override
    public IdentityKind getKind() {
        return IdentityKind.SECONDARY;
    }
}
