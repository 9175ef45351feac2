package com.demoBank.onboarding.signup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed per-step payloads collected so far. A null field means the step has not stored anything yet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StepData {

    private PersonalDetails personalDetails;

    private IdVerification primaryId;

    private IdVerification secondaryId;

    public StepData copy() {
        return new StepData(
                personalDetails == null ? null : personalDetails.toBuilder().build(),
                primaryId == null ? null : primaryId.copy(),
                secondaryId == null ? null : secondaryId.copy());
    }
}
