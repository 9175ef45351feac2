package com.demoBank.onboarding.account.service;

import com.demoBank.onboarding.account.exception.IdentifierExhaustedException;
import com.demoBank.onboarding.account.repository.AccountRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;

/**
 * Generates unique handles, customer ids and account numbers with bounded regeneration.
 */
@Service
public class AccountIdentifierGenerator {

    private static final int CUSTOMER_ID_MIN = 10_000;
    private static final int CUSTOMER_ID_MAX = 99_999;
    private static final long ACCOUNT_NUMBER_MIN = 1_000_000_000L;
    private static final long ACCOUNT_NUMBER_MAX = 9_999_999_999L;

    private final AccountRepository accountRepository;
    private final int maxAttempts;
    private final Random random;

    @Autowired
    public AccountIdentifierGenerator(AccountRepository accountRepository,
                                      @Value("${onboarding.account.max-generation-attempts:1000}") int maxAttempts) {
        this(accountRepository, maxAttempts, new SecureRandom());
    }

    AccountIdentifierGenerator(AccountRepository accountRepository, int maxAttempts, Random random) {
        this.accountRepository = accountRepository;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * Initials of the first two name parts plus the last 4 phone digits, e.g. "jd3210".
     * A taken handle gets a numeric suffix: "jd32102", "jd32103", ...
     */
    public String handleFor(String fullName, String phone) {
        String base = baseHandle(fullName, phone);
        if (!accountRepository.existsByHandle(base)) {
            return base;
        }
        for (int suffix = 2; suffix < maxAttempts + 2; suffix++) {
            String candidate = base + suffix;
            if (!accountRepository.existsByHandle(candidate)) {
                return candidate;
            }
        }
        throw new IdentifierExhaustedException("Unable to generate unique handle after " + maxAttempts + " attempts");
    }

    public int nextCustomerId() {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int candidate = CUSTOMER_ID_MIN + random.nextInt(CUSTOMER_ID_MAX - CUSTOMER_ID_MIN + 1);
            if (!accountRepository.existsByCustomerId(candidate)) {
                return candidate;
            }
        }
        throw new IdentifierExhaustedException("Unable to generate unique customer ID after " + maxAttempts + " attempts");
    }

    public String nextAccountNumber() {
        long span = ACCOUNT_NUMBER_MAX - ACCOUNT_NUMBER_MIN + 1;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            long candidate = ACCOUNT_NUMBER_MIN + Math.floorMod(random.nextLong(), span);
            String accountNumber = Long.toString(candidate);
            if (!accountRepository.existsByAccountNumber(accountNumber)) {
                return accountNumber;
            }
        }
        throw new IdentifierExhaustedException("Unable to generate unique account number after " + maxAttempts + " attempts");
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    static String baseHandle(String fullName, String phone) {
        StringBuilder initials = new StringBuilder();
        if (fullName != null) {
            String[] parts = fullName.trim().toLowerCase(Locale.ROOT).split("\\s+");
            for (int i = 0; i < parts.length && initials.length() < 2; i++) {
                if (!parts[i].isEmpty() && Character.isLetterOrDigit(parts[i].charAt(0))) {
                    initials.append(parts[i].charAt(0));
                }
            }
        }
        if (initials.length() == 0) {
            initials.append("user");
        }
        String phoneSuffix = phone == null || phone.length() < 4 ? "0000" : phone.substring(phone.length() - 4);
        return initials + phoneSuffix;
    }
}
