package com.demoBank.onboarding.signup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Step 2 payload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PersonalDetails {

    private String fullName;
    private String email;
    private LocalDate dateOfBirth;

    /**
     * "M", "F" or "O".
     */
    private String gender;

    private Instant savedAt;
}
