package com.demoBank.onboarding.signup.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdentityDocumentRequest {

    @NotBlank(message = "identifier is required")
    private String identifier;

    /**
     * Current residential address. Required for the primary ID, ignored for the secondary ID.
     */
    private String address;
}
