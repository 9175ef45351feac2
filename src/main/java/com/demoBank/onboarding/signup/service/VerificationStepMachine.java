package com.demoBank.onboarding.signup.service;

import com.demoBank.onboarding.account.exception.DuplicateAccountKeyException;
import com.demoBank.onboarding.account.model.ProvisionedAccount;
import com.demoBank.onboarding.account.repository.AccountRepository;
import com.demoBank.onboarding.account.service.AccountProvisioner;
import com.demoBank.onboarding.audit.model.VerificationStatus;
import com.demoBank.onboarding.audit.service.VerificationLog;
import com.demoBank.onboarding.identity.model.IdentityClaims;
import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.identity.model.IdentityRecord;
import com.demoBank.onboarding.identity.model.MatchResult;
import com.demoBank.onboarding.identity.service.IdentityRegistry;
import com.demoBank.onboarding.otp.model.OtpChallenge;
import com.demoBank.onboarding.otp.model.OtpCheckOutcome;
import com.demoBank.onboarding.otp.model.OtpPurpose;
import com.demoBank.onboarding.otp.service.OtpGenerator;
import com.demoBank.onboarding.otp.service.OtpNotifier;
import com.demoBank.onboarding.otp.service.OtpSendThrottle;
import com.demoBank.onboarding.signup.dto.AccountCreatedResponse;
import com.demoBank.onboarding.signup.dto.IdentityOtpResponse;
import com.demoBank.onboarding.signup.dto.OtpIssuedResponse;
import com.demoBank.onboarding.signup.dto.SessionProgressResponse;
import com.demoBank.onboarding.signup.dto.StepAdvanceResponse;
import com.demoBank.onboarding.signup.model.IdVerification;
import com.demoBank.onboarding.signup.model.IdVerificationState;
import com.demoBank.onboarding.signup.model.PersonalDetails;
import com.demoBank.onboarding.signup.model.SignupCompletion;
import com.demoBank.onboarding.signup.model.SignupError;
import com.demoBank.onboarding.signup.model.SignupErrorCode;
import com.demoBank.onboarding.signup.model.SignupSession;
import com.demoBank.onboarding.signup.model.SignupStep;
import com.demoBank.onboarding.signup.model.StepData;
import com.demoBank.onboarding.signup.model.StepResult;
import com.demoBank.onboarding.signup.repository.SignupSessionStore;
import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Signup step machine - the five gated KYC steps.
 *
 * Flow:
 * 1. Mobile OTP (request, confirm)
 * 2. Personal details
 * 3. Primary ID: registry match + cross-check, then OTP
 * 4. Secondary ID: registry match + cross-check, then OTP
 * 5. PIN setup and account creation
 *
 * Every transition runs inside {@link SignupSessionStore#update} on a working copy, so a failed
 * transition never leaves a partial change. Business failures come back as {@link StepResult};
 * OTP codes are handed to the {@link OtpNotifier} only after the session has been stored.
 */
@Slf4j
@Service
public class VerificationStepMachine {

    private final SignupSessionStore sessionStore;
    private final OtpGenerator otpGenerator;
    private final OtpNotifier otpNotifier;
    private final OtpSendThrottle sendThrottle;
    private final IdentityRegistry identityRegistry;
    private final VerificationLog verificationLog;
    private final AccountProvisioner accountProvisioner;
    private final AccountRepository accountRepository;
    private final Clock clock;
    private final Duration sessionTtl;
    private final int otpMaxAttempts;

    public VerificationStepMachine(SignupSessionStore sessionStore,
                                   OtpGenerator otpGenerator,
                                   OtpNotifier otpNotifier,
                                   OtpSendThrottle sendThrottle,
                                   IdentityRegistry identityRegistry,
                                   VerificationLog verificationLog,
                                   AccountProvisioner accountProvisioner,
                                   AccountRepository accountRepository,
                                   Clock clock,
                                   @Value("${onboarding.session.ttl-minutes:30}") long sessionTtlMinutes,
                                   @Value("${onboarding.otp.max-attempts:3}") int otpMaxAttempts) {
        this.sessionStore = sessionStore;
        this.otpGenerator = otpGenerator;
        this.otpNotifier = otpNotifier;
        this.sendThrottle = sendThrottle;
        this.identityRegistry = identityRegistry;
        this.verificationLog = verificationLog;
        this.accountProvisioner = accountProvisioner;
        this.accountRepository = accountRepository;
        this.clock = clock;
        this.sessionTtl = Duration.ofMinutes(sessionTtlMinutes);
        this.otpMaxAttempts = otpMaxAttempts;
    }

    // ---------------------------------------------------------------- step 1

    /**
     * Starts (or resumes) the signup for a phone and sends it a mobile OTP.
     * A live incomplete session for the phone is reused and its previous code is superseded.
     *
     * @param rawPhone Phone as entered; formatting characters are ignored
     * @param rawCountryCode Country code, "+91" when absent
     * @return Session id and OTP lifetime
     */
    public StepResult<OtpIssuedResponse> requestMobileOtp(String rawPhone, String rawCountryCode) {
        String phone = SignupInputValidator.normalizePhone(rawPhone);
        if (phone == null) {
            return StepResult.fail(SignupError.builder()
                    .code(SignupErrorCode.INVALID_PHONE)
                    .message(SignupErrorCode.INVALID_PHONE.getDefaultMessage())
                    .fieldErrors(Map.of("phone", "Phone number must have 8 to 15 digits"))
                    .build());
        }
        String countryCode = SignupInputValidator.normalizeCountryCode(rawCountryCode);
        if (countryCode == null) {
            return StepResult.fail(SignupError.builder()
                    .code(SignupErrorCode.INVALID_PHONE)
                    .message(SignupErrorCode.INVALID_PHONE.getDefaultMessage())
                    .fieldErrors(Map.of("countryCode", "Country code must look like +91"))
                    .build());
        }
        if (accountRepository.existsByPhone(phone)) {
            log.info("Mobile OTP refused, phone already registered - phone: {}", IdentifierMasker.mask(phone));
            return StepResult.fail(SignupErrorCode.PHONE_ALREADY_REGISTERED);
        }
        long retryAfter = sendThrottle.tryAcquire(phone);
        if (retryAfter > 0) {
            return StepResult.fail(SignupError.rateLimited(SignupErrorCode.OTP_SEND_LIMIT, retryAfter));
        }

        Instant now = clock.instant();
        String code = otpGenerator.issue();
        Instant otpExpiresAt = otpGenerator.expiryFrom(now);

        String sessionId = sessionStore.upsertForPhone(phone, now,
                () -> newSession(phone, countryCode, now),
                (session, created) -> {
                    session.setCountryCode(countryCode);
                    if (session.getMobileOtp() == null) {
                        session.setMobileOtp(new OtpChallenge());
                    }
                    session.getMobileOtp().reissue(code, otpExpiresAt);
                    session.setUpdatedAt(now);
                    if (!created) {
                        log.info("Reusing signup session - sessionId: {}, phone: {}, step: {}",
                                session.getSessionId(), IdentifierMasker.mask(phone), session.getCurrentStep());
                    }
                    return session.getSessionId();
                });

        otpNotifier.send(phone, countryCode, code, OtpPurpose.MOBILE_VERIFICATION);
        log.info("Mobile OTP issued - sessionId: {}, phone: {}", sessionId, IdentifierMasker.mask(phone));

        return StepResult.ok(OtpIssuedResponse.builder()
                .sessionId(sessionId)
                .expiresInSeconds(otpGenerator.getTtlSeconds())
                .sentTo(IdentifierMasker.formatPhone(phone, countryCode))
                .build());
    }

    public StepResult<StepAdvanceResponse> confirmMobileOtp(String sessionId, String code) {
        Instant now = clock.instant();
        return sessionStore.update(sessionId, session -> {
            Optional<SignupError> inactive = checkActive(session, now);
            if (inactive.isPresent()) {
                return StepResult.<StepAdvanceResponse>fail(inactive.get());
            }
            OtpChallenge challenge = session.getMobileOtp();
            if (challenge == null) {
                return StepResult.<StepAdvanceResponse>fail(SignupErrorCode.NO_OTP);
            }
            OtpCheckOutcome outcome = challenge.check(code, now, otpMaxAttempts);
            session.setUpdatedAt(now);
            if (outcome != OtpCheckOutcome.VERIFIED) {
                log.info("Mobile OTP rejected - sessionId: {}, outcome: {}", session.getSessionId(), outcome);
                return StepResult.<StepAdvanceResponse>fail(otpFailure(outcome, challenge));
            }
            session.setMobileVerifiedAt(now);
            session.advanceTo(SignupStep.PERSONAL_DETAILS);
            log.info("Mobile verified - sessionId: {}, phone: {}",
                    session.getSessionId(), IdentifierMasker.mask(session.getPhone()));
            return StepResult.ok(StepAdvanceResponse.builder()
                    .sessionId(session.getSessionId())
                    .nextStep(session.getCurrentStep())
                    .build());
        }).orElseGet(() -> StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND));
    }

    // ---------------------------------------------------------------- step 2

    /**
     * Stores personal details. Re-submitting is allowed; if the name, date of birth or gender
     * change, ID verifications made against the old details are discarded and must be redone.
     */
    public StepResult<StepAdvanceResponse> submitPersonalDetails(String sessionId,
                                                                 String fullName,
                                                                 String email,
                                                                 LocalDate dateOfBirth,
                                                                 String gender) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        return sessionStore.update(sessionId, session -> {
            Optional<SignupError> blocked = checkReached(session, SignupStep.PERSONAL_DETAILS, now);
            if (blocked.isPresent()) {
                return StepResult.<StepAdvanceResponse>fail(blocked.get());
            }
            Map<String, String> fieldErrors =
                    SignupInputValidator.validatePersonalDetails(fullName, email, dateOfBirth, gender, today);
            if (!fieldErrors.isEmpty()) {
                return StepResult.<StepAdvanceResponse>fail(SignupError.validation(fieldErrors));
            }
            if (accountRepository.existsByEmail(email)) {
                log.info("Personal details refused, email already registered - sessionId: {}", session.getSessionId());
                return StepResult.<StepAdvanceResponse>fail(SignupError.builder()
                        .code(SignupErrorCode.EMAIL_ALREADY_REGISTERED)
                        .message(SignupErrorCode.EMAIL_ALREADY_REGISTERED.getDefaultMessage())
                        .fieldErrors(Map.of("email", "Email is already registered"))
                        .build());
            }

            PersonalDetails details = PersonalDetails.builder()
                    .fullName(fullName.trim())
                    .email(email.trim())
                    .dateOfBirth(dateOfBirth)
                    .gender(gender.trim().toUpperCase())
                    .savedAt(now)
                    .build();

            StepData stepData = session.getStepData();
            PersonalDetails previous = stepData.getPersonalDetails();
            if (previous != null && !sameClaims(previous, details)
                    && (stepData.getPrimaryId() != null || stepData.getSecondaryId() != null)) {
                stepData.setPrimaryId(null);
                stepData.setSecondaryId(null);
                log.info("Personal details changed, ID verifications reset - sessionId: {}", session.getSessionId());
            }
            stepData.setPersonalDetails(details);
            session.advanceTo(SignupStep.PRIMARY_ID);
            session.setUpdatedAt(now);

            log.info("Personal details saved - sessionId: {}, step: {}", session.getSessionId(), session.getCurrentStep());
            return StepResult.ok(StepAdvanceResponse.builder()
                    .sessionId(session.getSessionId())
                    .nextStep(session.getCurrentStep())
                    .build());
        }).orElseGet(() -> StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND));
    }

    // ---------------------------------------------------------------- steps 3 and 4

    /**
     * Matches the document against the registry and the saved personal details, then sends an OTP
     * to the session's phone. The step does not advance until the OTP is confirmed.
     *
     * @param sessionId Session
     * @param kind Which document
     * @param rawIdentifier Identifier as entered
     * @param address Current address; required for {@link IdentityKind#PRIMARY}
     * @return Masked identifier, registry holder name and OTP lifetime
     */
    public StepResult<IdentityOtpResponse> requestIdOtp(String sessionId,
                                                        IdentityKind kind,
                                                        String rawIdentifier,
                                                        String address) {
        Instant now = clock.instant();
        String[] dispatch = new String[2]; // code, phone
        String[] countryCode = new String[1];

        StepResult<IdentityOtpResponse> result = sessionStore.update(sessionId, session -> {
            Optional<SignupError> blocked = checkReached(session, stepFor(kind), now);
            if (blocked.isPresent()) {
                return StepResult.<IdentityOtpResponse>fail(blocked.get());
            }
            PersonalDetails details = session.getStepData().getPersonalDetails();
            if (details == null) {
                return StepResult.<IdentityOtpResponse>fail(SignupError.of(
                        SignupErrorCode.PRECONDITION_NOT_MET, "Personal details must be saved first"));
            }

            String identifier = kind.normalize(rawIdentifier);
            if (!kind.isValidFormat(identifier)) {
                return StepResult.<IdentityOtpResponse>fail(SignupError.validation("identifier", kind.formatHint()));
            }
            if (kind == IdentityKind.PRIMARY && (address == null || address.isBlank())) {
                return StepResult.<IdentityOtpResponse>fail(SignupError.validation("address", "Current address is required"));
            }

            String last4 = identifier.substring(identifier.length() - 4);
            Optional<IdentityRecord> found = identityRegistry.lookupByIdentifier(kind, identifier);
            if (found.isEmpty()) {
                verificationLog.append(session.getSessionId(), kind.getProviderTag(), VerificationStatus.FAILED,
                        new Document("reason", "record_not_found").append("last4", last4));
                log.info("ID not found in registry - sessionId: {}, kind: {}", session.getSessionId(), kind);
                return StepResult.<IdentityOtpResponse>fail(SignupErrorCode.RECORD_NOT_FOUND);
            }

            IdentityRecord record = found.get();
            MatchResult match = identityRegistry.crossCheck(record,
                    new IdentityClaims(details.getFullName(), details.getDateOfBirth(), details.getGender()));
            if (!match.isMatch()) {
                verificationLog.append(session.getSessionId(), kind.getProviderTag(), VerificationStatus.FAILED,
                        new Document("reason", "identity_mismatch")
                                .append("last4", last4)
                                .append("mismatchedFields", match.mismatchedFields()));
                log.info("ID cross-check failed - sessionId: {}, kind: {}, fields: {}",
                        session.getSessionId(), kind, match.mismatchedFields());
                return StepResult.<IdentityOtpResponse>fail(SignupError.mismatch(match.mismatchedFields()));
            }

            if (accountRepository.existsByIdentityHash(kind, record.getIdHash())) {
                verificationLog.append(session.getSessionId(), kind.getProviderTag(), VerificationStatus.FAILED,
                        new Document("reason", "already_registered").append("last4", last4));
                log.info("ID already linked to an account - sessionId: {}, kind: {}", session.getSessionId(), kind);
                return StepResult.<IdentityOtpResponse>fail(SignupErrorCode.IDENTITY_ALREADY_REGISTERED);
            }

            long retryAfter = sendThrottle.tryAcquire(session.getPhone());
            if (retryAfter > 0) {
                return StepResult.<IdentityOtpResponse>fail(
                        SignupError.rateLimited(SignupErrorCode.OTP_SEND_LIMIT, retryAfter));
            }

            String code = otpGenerator.issue();
            IdVerification verification = IdVerification.builder()
                    .kind(kind)
                    .recordHash(record.getIdHash())
                    .last4(record.getLast4())
                    .holderName(record.getFullName())
                    .address(kind == IdentityKind.PRIMARY ? address.trim() : null)
                    .state(IdVerificationState.OTP_SENT)
                    .otp(OtpChallenge.builder().code(code).expiresAt(otpGenerator.expiryFrom(now)).build())
                    .otpSentAt(now)
                    .build();
            if (kind == IdentityKind.PRIMARY) {
                session.getStepData().setPrimaryId(verification);
            } else {
                session.getStepData().setSecondaryId(verification);
            }
            session.setUpdatedAt(now);

            dispatch[0] = code;
            dispatch[1] = session.getPhone();
            countryCode[0] = session.getCountryCode();
            return StepResult.ok(IdentityOtpResponse.builder()
                    .maskedIdentifier(verification.maskedIdentifier())
                    .holderName(verification.getHolderName())
                    .expiresInSeconds(otpGenerator.getTtlSeconds())
                    .build());
        }).orElseGet(() -> StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND));

        if (result.isSuccess() && dispatch[0] != null) {
            otpNotifier.send(dispatch[1], countryCode[0], dispatch[0], purposeFor(kind));
            log.info("ID OTP issued - sessionId: {}, kind: {}, identifier: {}",
                    sessionId, kind, result.getValue().getMaskedIdentifier());
        }
        return result;
    }

    public StepResult<StepAdvanceResponse> confirmIdOtp(String sessionId, IdentityKind kind, String code) {
        Instant now = clock.instant();
        return sessionStore.update(sessionId, session -> {
            Optional<SignupError> blocked = checkReached(session, stepFor(kind), now);
            if (blocked.isPresent()) {
                return StepResult.<StepAdvanceResponse>fail(blocked.get());
            }
            StepData stepData = session.getStepData();
            IdVerification verification = kind == IdentityKind.PRIMARY ? stepData.getPrimaryId() : stepData.getSecondaryId();
            if (verification == null) {
                return StepResult.<StepAdvanceResponse>fail(SignupError.of(
                        SignupErrorCode.PRECONDITION_NOT_MET, "Request an OTP for this ID first"));
            }
            if (verification.isVerified() || verification.getOtp() == null) {
                return StepResult.<StepAdvanceResponse>fail(SignupErrorCode.NO_OTP);
            }

            OtpChallenge challenge = verification.getOtp();
            OtpCheckOutcome outcome = challenge.check(code, now, otpMaxAttempts);
            session.setUpdatedAt(now);
            if (outcome != OtpCheckOutcome.VERIFIED) {
                if (outcome == OtpCheckOutcome.WRONG && challenge.attemptsLeft(otpMaxAttempts) == 0) {
                    verificationLog.append(session.getSessionId(), kind.getProviderTag(), VerificationStatus.FAILED,
                            new Document("reason", "otp_attempts_exhausted")
                                    .append("maskedIdentifier", verification.maskedIdentifier()));
                }
                log.info("ID OTP rejected - sessionId: {}, kind: {}, outcome: {}", session.getSessionId(), kind, outcome);
                return StepResult.<StepAdvanceResponse>fail(otpFailure(outcome, challenge));
            }

            verification.setState(IdVerificationState.VERIFIED);
            verification.setVerifiedAt(now);
            session.advanceTo(kind == IdentityKind.PRIMARY ? SignupStep.SECONDARY_ID : SignupStep.PIN_SETUP);

            verificationLog.append(session.getSessionId(), kind.getProviderTag(), VerificationStatus.SUCCESS,
                    new Document("maskedIdentifier", verification.maskedIdentifier())
                            .append("holderName", verification.getHolderName())
                            .append("verifiedAt", Date.from(now)));
            log.info("ID verified - sessionId: {}, kind: {}, identifier: {}",
                    session.getSessionId(), kind, verification.maskedIdentifier());

            return StepResult.ok(StepAdvanceResponse.builder()
                    .sessionId(session.getSessionId())
                    .nextStep(session.getCurrentStep())
                    .maskedIdentifier(verification.maskedIdentifier())
                    .build());
        }).orElseGet(() -> StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND));
    }

    // ---------------------------------------------------------------- step 5

    /**
     * Sets the PIN and creates the user and bank account. On success the session is completed
     * and becomes read-only; on any failure it stays at step 5 unchanged.
     */
    public StepResult<AccountCreatedResponse> setupPin(String sessionId,
                                                       String pin,
                                                       String confirmPin,
                                                       boolean termsAccepted) {
        Instant now = clock.instant();
        return sessionStore.update(sessionId, session -> {
            Optional<SignupError> blocked = checkReached(session, SignupStep.PIN_SETUP, now);
            if (blocked.isPresent()) {
                return StepResult.<AccountCreatedResponse>fail(blocked.get());
            }
            if (!allVerified(session)) {
                return StepResult.<AccountCreatedResponse>fail(SignupErrorCode.NOT_ALL_VERIFIED);
            }
            Map<String, String> fieldErrors = SignupInputValidator.validatePin(pin, confirmPin, termsAccepted);
            if (!fieldErrors.isEmpty()) {
                return StepResult.<AccountCreatedResponse>fail(SignupError.validation(fieldErrors));
            }

            ProvisionedAccount provisioned;
            try {
                provisioned = accountProvisioner.provision(session, pin, now, now);
            } catch (DuplicateAccountKeyException e) {
                log.warn("Account creation refused, {} already registered - sessionId: {}, phone: {}",
                        e.getKey(), session.getSessionId(), IdentifierMasker.mask(session.getPhone()));
                return StepResult.<AccountCreatedResponse>fail(duplicateFailure(e.getKey()));
            }

            session.setCompleted(true);
            session.setCompletion(SignupCompletion.builder()
                    .accountHandle(provisioned.user().getHandle())
                    .accountNumber(provisioned.bankAccount().getAccountNumber())
                    .customerId(provisioned.user().getCustomerId())
                    .termsAcceptedAt(now)
                    .completedAt(now)
                    .build());
            session.setUpdatedAt(now);

            log.info("Signup completed - sessionId: {}, phone: {}",
                    session.getSessionId(), IdentifierMasker.mask(session.getPhone()));
            return StepResult.ok(AccountCreatedResponse.builder()
                    .accountHandle(provisioned.user().getHandle())
                    .accountNumber(provisioned.bankAccount().getAccountNumber())
                    .holderName(provisioned.user().getFullName())
                    .customerId(provisioned.user().getCustomerId())
                    .accountDisplayName(provisioned.bankAccount().getDisplayName())
                    .creditScore(provisioned.user().getCreditScore())
                    .build());
        }).orElseGet(() -> StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND));
    }

    // ---------------------------------------------------------------- progress

    /**
     * Reports where a session stands. An expired session is removed on the way.
     */
    public StepResult<SessionProgressResponse> describeSession(String sessionId) {
        Instant now = clock.instant();
        Optional<SignupSession> found = sessionStore.findById(sessionId);
        if (found.isEmpty()) {
            return StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND);
        }
        SignupSession session = found.get();
        if (session.isExpired(now)) {
            sessionStore.removeIfExpired(sessionId, now);
            return StepResult.fail(SignupErrorCode.SESSION_EXPIRED);
        }
        StepData stepData = session.getStepData();
        return StepResult.ok(SessionProgressResponse.builder()
                .sessionId(session.getSessionId())
                .currentStep(session.getCurrentStep())
                .stepName(session.currentSignupStep().getDisplayName())
                .phoneDisplay(IdentifierMasker.formatPhone(session.getPhone(), session.getCountryCode()))
                .mobileVerified(session.isMobileVerified())
                .personalDetailsSaved(stepData.getPersonalDetails() != null)
                .primaryIdVerified(stepData.getPrimaryId() != null && stepData.getPrimaryId().isVerified())
                .secondaryIdVerified(stepData.getSecondaryId() != null && stepData.getSecondaryId().isVerified())
                .completed(session.isCompleted())
                .expiresAt(session.getExpiresAt())
                .build());
    }

    private SignupSession newSession(String phone, String countryCode, Instant now) {
        return SignupSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .phone(phone)
                .countryCode(countryCode)
                .currentStep(SignupStep.MOBILE.getNumber())
                .stepData(new StepData())
                .mobileOtp(new OtpChallenge())
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(sessionTtl))
                .build();
    }

    private Optional<SignupError> checkActive(SignupSession session, Instant now) {
        if (session.isCompleted()) {
            return Optional.of(SignupError.of(SignupErrorCode.SESSION_COMPLETED));
        }
        if (session.isExpired(now)) {
            return Optional.of(SignupError.of(SignupErrorCode.SESSION_EXPIRED));
        }
        return Optional.empty();
    }

    private Optional<SignupError> checkReached(SignupSession session, SignupStep step, Instant now) {
        Optional<SignupError> inactive = checkActive(session, now);
        if (inactive.isPresent()) {
            return inactive;
        }
        if (!session.hasReached(step)) {
            return Optional.of(SignupError.of(SignupErrorCode.PRECONDITION_NOT_MET,
                    "Complete step " + (step.getNumber() - 1) + " before " + step.getDisplayName()));
        }
        return Optional.empty();
    }

    private boolean allVerified(SignupSession session) {
        StepData stepData = session.getStepData();
        return session.isMobileVerified()
                && stepData.getPersonalDetails() != null
                && stepData.getPrimaryId() != null && stepData.getPrimaryId().isVerified()
                && stepData.getSecondaryId() != null && stepData.getSecondaryId().isVerified();
    }

    private SignupError otpFailure(OtpCheckOutcome outcome, OtpChallenge challenge) {
        return switch (outcome) {
            case TOO_MANY_ATTEMPTS -> SignupError.withAttemptsLeft(SignupErrorCode.TOO_MANY_ATTEMPTS, 0);
            case NO_OTP -> SignupError.of(SignupErrorCode.NO_OTP);
            case EXPIRED -> SignupError.of(SignupErrorCode.OTP_EXPIRED);
            case WRONG -> SignupError.withAttemptsLeft(SignupErrorCode.WRONG_OTP, challenge.attemptsLeft(otpMaxAttempts));
            case VERIFIED -> throw new IllegalArgumentException("Not a failure: " + outcome);
        };
    }

    private static SignupErrorCode duplicateFailure(String key) {
        return switch (key) {
            case "email" -> SignupErrorCode.EMAIL_ALREADY_REGISTERED;
            case "primaryId", "secondaryId" -> SignupErrorCode.IDENTITY_ALREADY_REGISTERED;
            default -> SignupErrorCode.PHONE_ALREADY_REGISTERED;
        };
    }

    private static boolean sameClaims(PersonalDetails a, PersonalDetails b) {
        return a.getFullName().equalsIgnoreCase(b.getFullName())
                && a.getDateOfBirth().equals(b.getDateOfBirth())
                && a.getGender().equals(b.getGender());
    }

    private static SignupStep stepFor(IdentityKind kind) {
        return kind == IdentityKind.PRIMARY ? SignupStep.PRIMARY_ID : SignupStep.SECONDARY_ID;
    }

    private static OtpPurpose purposeFor(IdentityKind kind) {
        return kind == IdentityKind.PRIMARY ? OtpPurpose.PRIMARY_ID_VERIFICATION : OtpPurpose.SECONDARY_ID_VERIFICATION;
    }
}
