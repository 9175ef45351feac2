package com.demoBank.onboarding.account.service;

import com.demoBank.onboarding.account.exception.DuplicateAccountKeyException;
import com.demoBank.onboarding.account.exception.IdentifierExhaustedException;
import com.demoBank.onboarding.account.model.AccountStatus;
import com.demoBank.onboarding.account.model.BankAccount;
import com.demoBank.onboarding.account.model.PinCheck;
import com.demoBank.onboarding.account.model.ProvisionedAccount;
import com.demoBank.onboarding.account.model.UserAccount;
import com.demoBank.onboarding.account.repository.AccountRepository;
import com.demoBank.onboarding.signup.model.IdVerification;
import com.demoBank.onboarding.signup.model.PersonalDetails;
import com.demoBank.onboarding.signup.model.SignupSession;
import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Set;

/**
 * Turns a fully verified signup session into a permanent user and bank account.
 *
 * Both entities are committed by a single repository call, so a failure leaves nothing behind.
 * Marking the session completed is the caller's job, inside the same session transaction.
 */
@Slf4j
@Service
public class AccountProvisioner {

    // keys that belong to the applicant; regenerating cannot resolve them
    private static final Set<String> OWNER_KEYS = Set.of("phone", "email", "primaryId", "secondaryId");

    private final AccountRepository accountRepository;
    private final AccountIdentifierGenerator identifierGenerator;
    private final PinSecurity pinSecurity;
    private final CreditScoreCalculator creditScoreCalculator;
    private final String accountDisplayName;
    private final String accountType;

    public AccountProvisioner(AccountRepository accountRepository,
                              AccountIdentifierGenerator identifierGenerator,
                              PinSecurity pinSecurity,
                              CreditScoreCalculator creditScoreCalculator,
                              @Value("${onboarding.account.display-name:NeoBank Savings}") String accountDisplayName,
                              @Value("${onboarding.account.account-type:savings}") String accountType) {
        this.accountRepository = accountRepository;
        this.identifierGenerator = identifierGenerator;
        this.pinSecurity = pinSecurity;
        this.creditScoreCalculator = creditScoreCalculator;
        this.accountDisplayName = accountDisplayName;
        this.accountType = accountType;
    }

    /**
     * Creates the user (with hashed PIN) and its bank account. The user is approved on creation.
     *
     * @param session Session with personal details and both ID verifications present
     * @param pin 6-digit PIN, already validated
     * @param termsAcceptedAt When the terms were accepted
     * @param now Creation time
     * @return The stored user and account
     * @throws DuplicateAccountKeyException if the phone, email or either ID is already registered
     * @throws IdentifierExhaustedException if unique identifiers could not be generated
     */
    public ProvisionedAccount provision(SignupSession session, String pin, Instant termsAcceptedAt, Instant now) {
        PersonalDetails details = session.getStepData().getPersonalDetails();
        IdVerification primaryId = session.getStepData().getPrimaryId();
        IdVerification secondaryId = session.getStepData().getSecondaryId();
        if (details == null || primaryId == null || secondaryId == null) {
            throw new IllegalStateException("Session " + session.getSessionId() + " is missing verified step data");
        }

        int creditScore = creditScoreCalculator.scoreFor(details.getDateOfBirth());
        int maxAttempts = identifierGenerator.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            UserAccount user = UserAccount.builder()
                    .handle(identifierGenerator.handleFor(details.getFullName(), session.getPhone()))
                    .customerId(identifierGenerator.nextCustomerId())
                    .phone(session.getPhone())
                    .countryCode(session.getCountryCode())
                    .phoneVerified(session.isMobileVerified())
                    .email(details.getEmail())
                    .fullName(details.getFullName())
                    .dateOfBirth(details.getDateOfBirth())
                    .gender(details.getGender())
                    .address(primaryId.getAddress())
                    .maskedPrimaryId(primaryId.maskedIdentifier())
                    .maskedSecondaryId(secondaryId.maskedIdentifier())
                    .primaryIdHash(primaryId.getRecordHash())
                    .secondaryIdHash(secondaryId.getRecordHash())
                    .accountStatus(AccountStatus.APPROVED)
                    .creditScore(creditScore)
                    .approvedAt(now)
                    .termsAcceptedAt(termsAcceptedAt)
                    .createdAt(now)
                    .build();

            if (pinSecurity.setPin(user, pin, now) != PinCheck.OK) {
                throw new IllegalArgumentException("PIN must be exactly 6 digits");
            }

            BankAccount bankAccount = BankAccount.builder()
                    .accountNumber(identifierGenerator.nextAccountNumber())
                    .ownerHandle(user.getHandle())
                    .displayName(accountDisplayName)
                    .accountType(accountType)
                    .createdAt(now)
                    .build();

            try {
                accountRepository.saveNew(user, bankAccount);
                log.info("Account provisioned - sessionId: {}, handle: {}, customerId: {}, attempt: {}",
                        session.getSessionId(), IdentifierMasker.mask(user.getHandle()), user.getCustomerId(), attempt);
                return new ProvisionedAccount(user, bankAccount);
            } catch (DuplicateAccountKeyException e) {
                if (OWNER_KEYS.contains(e.getKey())) {
                    throw e;
                }
                log.debug("Generated key collided, regenerating - sessionId: {}, key: {}, attempt: {}",
                        session.getSessionId(), e.getKey(), attempt);
            }
        }
        throw new IdentifierExhaustedException("Unable to store account after " + maxAttempts + " attempts");
    }
}
