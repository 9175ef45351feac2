package com.demoBank.onboarding.account.repository;

import com.demoBank.onboarding.account.exception.DuplicateAccountKeyException;
import com.demoBank.onboarding.account.model.BankAccount;
import com.demoBank.onboarding.account.model.UserAccount;
import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory store of users and their bank accounts with unique handle, phone, email,
 * customer id, account number and identity documents. All access is serialized on this repository.
 */
@Slf4j
@Repository
public class AccountRepository {

    private final Map<String, UserAccount> usersByHandle = new HashMap<>();
    private final Map<String, String> handleByPhone = new HashMap<>();
    private final Map<String, String> handleByEmail = new HashMap<>();
    private final Map<String, String> handleByPrimaryIdHash = new HashMap<>();
    private final Map<String, String> handleBySecondaryIdHash = new HashMap<>();
    private final Set<Integer> customerIds = new HashSet<>();
    private final Map<String, BankAccount> accountsByNumber = new HashMap<>();

    public synchronized boolean existsByHandle(String handle) {
        return usersByHandle.containsKey(handle);
    }

    public synchronized boolean existsByPhone(String phone) {
        return handleByPhone.containsKey(phone);
    }

    /**
     * Emails are compared case-insensitively.
     */
    public synchronized boolean existsByEmail(String email) {
        return email != null && handleByEmail.containsKey(normalizeEmail(email));
    }

    public synchronized boolean existsByIdentityHash(IdentityKind kind, String idHash) {
        return idHash != null && identityIndex(kind).containsKey(idHash);
    }

    public synchronized boolean existsByCustomerId(int customerId) {
        return customerIds.contains(customerId);
    }

    public synchronized boolean existsByAccountNumber(String accountNumber) {
        return accountsByNumber.containsKey(accountNumber);
    }

    /**
     * Inserts a user and its bank account as one unit: either both are stored or neither.
     *
     * @throws DuplicateAccountKeyException if any unique key is already taken
     */
    public synchronized void saveNew(UserAccount user, BankAccount bankAccount) {
        if (usersByHandle.containsKey(user.getHandle())) {
            throw new DuplicateAccountKeyException("handle", "Handle already taken");
        }
        if (handleByPhone.containsKey(user.getPhone())) {
            throw new DuplicateAccountKeyException("phone", "Phone already registered");
        }
        if (user.getEmail() != null && handleByEmail.containsKey(normalizeEmail(user.getEmail()))) {
            throw new DuplicateAccountKeyException("email", "Email already registered");
        }
        if (user.getPrimaryIdHash() != null && handleByPrimaryIdHash.containsKey(user.getPrimaryIdHash())) {
            throw new DuplicateAccountKeyException("primaryId", "Primary ID already registered");
        }
        if (user.getSecondaryIdHash() != null && handleBySecondaryIdHash.containsKey(user.getSecondaryIdHash())) {
            throw new DuplicateAccountKeyException("secondaryId", "Secondary ID already registered");
        }
        if (customerIds.contains(user.getCustomerId())) {
            throw new DuplicateAccountKeyException("customerId", "Customer id already taken");
        }
        if (accountsByNumber.containsKey(bankAccount.getAccountNumber())) {
            throw new DuplicateAccountKeyException("accountNumber", "Account number already taken");
        }
        usersByHandle.put(user.getHandle(), user.copy());
        handleByPhone.put(user.getPhone(), user.getHandle());
        if (user.getEmail() != null) {
            handleByEmail.put(normalizeEmail(user.getEmail()), user.getHandle());
        }
        if (user.getPrimaryIdHash() != null) {
            handleByPrimaryIdHash.put(user.getPrimaryIdHash(), user.getHandle());
        }
        if (user.getSecondaryIdHash() != null) {
            handleBySecondaryIdHash.put(user.getSecondaryIdHash(), user.getHandle());
        }
        customerIds.add(user.getCustomerId());
        accountsByNumber.put(bankAccount.getAccountNumber(), bankAccount);
        log.info("Stored new user and account - handle: {}, phone: {}",
                IdentifierMasker.mask(user.getHandle()), IdentifierMasker.mask(user.getPhone()));
    }

    public synchronized Optional<UserAccount> findByPhone(String phone) {
        String handle = handleByPhone.get(phone);
        return handle == null ? Optional.empty() : Optional.of(usersByHandle.get(handle).copy());
    }

    public synchronized Optional<UserAccount> findByHandle(String handle) {
        return Optional.ofNullable(usersByHandle.get(handle)).map(UserAccount::copy);
    }

    public synchronized List<BankAccount> findAccountsByOwner(String handle) {
        return accountsByNumber.values().stream()
                .filter(account -> account.getOwnerHandle().equals(handle))
                .collect(Collectors.toList());
    }

    /**
     * Atomic read-modify-write of a user found by phone.
     *
     * @return result of the update, or empty if no user has that phone
     */
    public synchronized <R> Optional<R> updateByPhone(String phone, Function<UserAccount, R> update) {
        String handle = handleByPhone.get(phone);
        if (handle == null) {
            return Optional.empty();
        }
        UserAccount working = usersByHandle.get(handle).copy();
        R result = update.apply(working);
        usersByHandle.put(handle, working);
        return Optional.ofNullable(result);
    }

    private Map<String, String> identityIndex(IdentityKind kind) {
        return kind == IdentityKind.PRIMARY ? handleByPrimaryIdHash : handleBySecondaryIdHash;
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
