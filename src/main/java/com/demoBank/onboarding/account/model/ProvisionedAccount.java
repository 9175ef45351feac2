package com.demoBank.onboarding.account.model;

/**
 * User and bank account created together by a completed signup.
 */
public record ProvisionedAccount(UserAccount user, BankAccount bankAccount) {
}
