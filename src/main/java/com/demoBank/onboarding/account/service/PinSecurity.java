package com.demoBank.onboarding.account.service;

import com.demoBank.onboarding.account.model.PinCheck;
import com.demoBank.onboarding.account.model.PinVerification;
import com.demoBank.onboarding.account.model.UserAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * PIN hashing, verification and lockout policy.
 *
 * Both operations mutate the given account; the caller persists it within one atomic update.
 */
@Slf4j
@Service
public class PinSecurity {

    private static final Pattern PIN_FORMAT = Pattern.compile("^\\d{6}$");

    private final PasswordEncoder pinEncoder;
    private final int maxAttempts;
    private final Duration lockout;

    public PinSecurity(PasswordEncoder pinEncoder,
                       @Value("${onboarding.pin.max-attempts:3}") int maxAttempts,
                       @Value("${onboarding.pin.lockout-minutes:15}") long lockoutMinutes) {
        this.pinEncoder = pinEncoder;
        this.maxAttempts = maxAttempts;
        this.lockout = Duration.ofMinutes(lockoutMinutes);
    }

    public static boolean isWellFormed(String pin) {
        return pin != null && PIN_FORMAT.matcher(pin).matches();
    }

    /**
     * Stores a salted hash of the PIN and clears attempts and lockout.
     *
     * @return {@link PinCheck#OK}, or {@link PinCheck#WRONG_FORMAT} if the PIN is not 6 digits (account unchanged)
     */
    public PinCheck setPin(UserAccount account, String pin, Instant now) {
        if (!isWellFormed(pin)) {
            return PinCheck.WRONG_FORMAT;
        }
        account.setPinHash(pinEncoder.encode(pin));
        account.setPinSetAt(now);
        account.setPinAttempts(0);
        account.setPinLockedUntil(null);
        return PinCheck.OK;
    }

    /**
     * Checks a PIN. The attempt that reaches the limit still reports {@link PinCheck#WRONG}
     * and starts the lockout; later calls report {@link PinCheck#LOCKED} until it ends.
     */
    public PinVerification verifyPin(UserAccount account, String pin, Instant now) {
        Instant lockedUntil = account.getPinLockedUntil();
        if (lockedUntil != null) {
            if (now.isBefore(lockedUntil)) {
                return new PinVerification(PinCheck.LOCKED, 0, lockedUntil);
            }
            // lockout over: start a fresh attempt window
            account.setPinLockedUntil(null);
            account.setPinAttempts(0);
        }
        if (!isWellFormed(pin)) {
            return new PinVerification(PinCheck.WRONG_FORMAT, attemptsLeft(account), null);
        }
        if (account.getPinHash() == null) {
            return new PinVerification(PinCheck.NO_PIN_SET, attemptsLeft(account), null);
        }
        if (pinEncoder.matches(pin, account.getPinHash())) {
            account.setPinAttempts(0);
            account.setPinLockedUntil(null);
            return new PinVerification(PinCheck.OK, maxAttempts, null);
        }

        account.setPinAttempts(account.getPinAttempts() + 1);
        if (account.getPinAttempts() >= maxAttempts) {
            account.setPinLockedUntil(now.plus(lockout));
            log.warn("PIN locked - attempts: {}, lockedUntil: {}", account.getPinAttempts(), account.getPinLockedUntil());
        }
        return new PinVerification(PinCheck.WRONG, attemptsLeft(account), account.getPinLockedUntil());
    }

    private int attemptsLeft(UserAccount account) {
        return Math.max(0, maxAttempts - account.getPinAttempts());
    }
}
