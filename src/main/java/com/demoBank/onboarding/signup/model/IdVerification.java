package com.demoBank.onboarding.signup.model;

import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.otp.model.OtpChallenge;
import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Step 3 / step 4 payload: a document matched against the registry and its OTP sub-phase.
 * Holds the record hash and last 4 characters only, never the identifier.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class IdVerification {

    private IdentityKind kind;

    /**
     * Registry key of the matched record.
     */
    private String recordHash;

    private String last4;

    /**
     * Name as held by the registry.
     */
    private String holderName;

    /**
     * Current address, primary ID only.
     */
    private String address;

    private IdVerificationState state;

    private OtpChallenge otp;

    private Instant otpSentAt;

    private Instant verifiedAt;

    public boolean isVerified() {
        return state == IdVerificationState.VERIFIED;
    }

    public String maskedIdentifier() {
        return IdentifierMasker.maskKeepingLast4(last4, kind.getIdentifierLength());
    }

    public IdVerification copy() {
        return toBuilder()
                .otp(otp == null ? null : otp.copy())
                .build();
    }
}
