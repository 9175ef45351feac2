package com.demoBank.onboarding.account.exception;

/**
 * Thrown by the account repository when a unique key is already taken.
 * Generated keys are regenerated; owner keys (phone, email, identity documents) fail the signup.
 */
public class DuplicateAccountKeyException extends RuntimeException {

    private final String key;

    public DuplicateAccountKeyException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * Which unique key collided: "handle", "customerId", "accountNumber", "phone", "email",
     * "primaryId" or "secondaryId".
     */
    public String getKey() {
        return key;
    }
}
