package com.demoBank.onboarding.identity.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Seed file entry as entered by an administrator. The full identifier is hashed on load and discarded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IdentitySeedRecord {

    private String identifier;
    private String fullName;
    private LocalDate dateOfBirth;

    // primary only
    private String gender;
    private String address;
    private String postalCode;

    // secondary only
    private String fatherName;
    private String status;

    /**
     * Defaults to active when absent from the seed file.
     */
    private Boolean active;

    public boolean isActiveOrDefault() {
        return active == null || active;
    }
}
