package com.demoBank.onboarding.account.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoginResponse {

    private String accountHandle;
    private int customerId;
    private String fullName;

    /**
     * Account numbers owned by the user.
     */
    private List<String> accountNumbers;
}
