package com.demoBank.onboarding.account.service;

import com.demoBank.onboarding.account.dto.LoginResponse;
import com.demoBank.onboarding.account.model.BankAccount;
import com.demoBank.onboarding.account.model.PinVerification;
import com.demoBank.onboarding.account.model.UserAccount;
import com.demoBank.onboarding.account.repository.AccountRepository;
import com.demoBank.onboarding.signup.model.SignupError;
import com.demoBank.onboarding.signup.model.SignupErrorCode;
import com.demoBank.onboarding.signup.model.StepResult;
import com.demoBank.onboarding.signup.service.SignupInputValidator;
import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Phone + PIN login for accounts created by the signup flow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final AccountRepository accountRepository;
    private final PinSecurity pinSecurity;
    private final Clock clock;

    public StepResult<LoginResponse> login(String rawPhone, String pin) {
        String phone = SignupInputValidator.normalizePhone(rawPhone);
        if (phone == null) {
            return StepResult.fail(SignupErrorCode.INVALID_PHONE);
        }
        Instant now = clock.instant();

        Optional<LoginAttempt> attempt = accountRepository.updateByPhone(phone,
                user -> new LoginAttempt(user.copy(), pinSecurity.verifyPin(user, pin, now)));
        if (attempt.isEmpty()) {
            log.info("Login for unknown phone - phone: {}", IdentifierMasker.mask(phone));
            return StepResult.fail(SignupErrorCode.ACCOUNT_NOT_FOUND);
        }

        UserAccount user = attempt.get().user();
        PinVerification verification = attempt.get().verification();
        switch (verification.outcome()) {
            case OK:
                log.info("Login succeeded - handle: {}", IdentifierMasker.mask(user.getHandle()));
                return StepResult.ok(LoginResponse.builder()
                        .accountHandle(user.getHandle())
                        .customerId(user.getCustomerId())
                        .fullName(user.getFullName())
                        .accountNumbers(accountRepository.findAccountsByOwner(user.getHandle()).stream()
                                .map(BankAccount::getAccountNumber)
                                .collect(Collectors.toList()))
                        .build());
            case LOCKED:
                log.warn("Login refused, PIN locked - handle: {}, lockedUntil: {}",
                        IdentifierMasker.mask(user.getHandle()), verification.lockedUntil());
                return StepResult.fail(SignupError.rateLimited(SignupErrorCode.PIN_LOCKED,
                        Duration.between(now, verification.lockedUntil()).toSeconds()));
            case WRONG_FORMAT:
                return StepResult.fail(SignupError.validation("pin", "PIN must be exactly 6 digits"));
            case NO_PIN_SET:
                return StepResult.fail(SignupErrorCode.NO_PIN_SET);
            default:
                log.info("Login failed, wrong PIN - handle: {}, attemptsLeft: {}",
                        IdentifierMasker.mask(user.getHandle()), verification.attemptsLeft());
                return StepResult.fail(SignupError.withAttemptsLeft(SignupErrorCode.WRONG_PIN, verification.attemptsLeft()));
        }
    }

    private record LoginAttempt(UserAccount user, PinVerification verification) {
    }
}
