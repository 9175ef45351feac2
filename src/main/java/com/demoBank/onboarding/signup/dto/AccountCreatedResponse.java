package com.demoBank.onboarding.signup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountCreatedResponse {

    private String accountHandle;
    private String accountNumber;
    private String holderName;
    private int customerId;
    private String accountDisplayName;
    private int creditScore;
}
