package com.demoBank.onboarding.account.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BankAccount {

    /**
     * Unique 10-digit account number.
     */
    private String accountNumber;

    /**
     * Handle of the owning user.
     */
    private String ownerHandle;

    /**
     * Display label, e.g. "NeoBank Savings".
     */
    private String displayName;

    private String accountType;

    private Instant createdAt;
}
