package com.demoBank.onboarding.signup.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Presence checks only; length, format and age rules are applied by the step itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PersonalDetailsRequest {

    @NotBlank(message = "fullName is required")
    private String fullName;

    @NotBlank(message = "email is required")
    private String email;

    @NotNull(message = "dateOfBirth is required")
    private LocalDate dateOfBirth;

    @NotBlank(message = "gender is required")
    private String gender;
}
