package com.demoBank.onboarding.signup.repository;

import com.demoBank.onboarding.signup.model.SignupSession;
import com.demoBank.onboarding.util.IdentifierMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Keyed storage of signup sessions.
 *
 * Every mutation is a read-modify-write on a private copy inside the map's per-key compute,
 * so two transitions on the same session never interleave and a transition that throws leaves
 * the stored session untouched. Callers only ever see copies.
 */
@Slf4j
@Repository
public class SignupSessionStore {

    private final Cache<String, SignupSession> sessionCache;

    private final ConcurrentMap<String, SignupSession> sessions;

    // phone -> sessionId of its incomplete session
    private final Map<String, String> openSessionByPhone = new ConcurrentHashMap<>();

    public SignupSessionStore(@Value("${onboarding.session.max-sessions:10000}") long maxSessions) {
        this.sessionCache = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .removalListener((String key, SignupSession value, RemovalCause cause) -> {
                    if (value != null && cause.wasEvicted()) {
                        log.warn("Session evicted - sessionId: {}, phone: {}, cause: {}",
                                key, IdentifierMasker.mask(value.getPhone()), cause);
                    }
                })
                .build();
        this.sessions = sessionCache.asMap();
    }

    public Optional<SignupSession> findById(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        SignupSession session = sessions.get(sessionId);
        return Optional.ofNullable(session).map(SignupSession::copy);
    }

    /**
     * Runs a transition against a working copy of the session and stores the copy afterwards.
     *
     * @param sessionId Session to update
     * @param transition Mutates the working copy and returns the transition result
     * @param <R> Result type
     * @return Result of the transition, or empty if the session does not exist
     */
    public <R> Optional<R> update(String sessionId, Function<SignupSession, R> transition) {
        if (sessionId == null) {
            return Optional.empty();
        }
        List<R> holder = new ArrayList<>(1);
        SignupSession[] committed = new SignupSession[1];
        sessions.computeIfPresent(sessionId, (id, stored) -> {
            SignupSession working = stored.copy();
            holder.add(transition.apply(working));
            committed[0] = working;
            return working;
        });
        // phone index is released outside the session lock; upsertForPhone takes the locks in the other order
        if (committed[0] != null && committed[0].isCompleted()) {
            openSessionByPhone.remove(committed[0].getPhone(), sessionId);
        }
        return holder.isEmpty() ? Optional.empty() : Optional.ofNullable(holder.get(0));
    }

    /**
     * Finds the open session for a phone, or creates one, and applies a transition to it atomically.
     * An expired or completed session for the phone is replaced by a fresh one.
     *
     * @param phone Digits-only phone number
     * @param now Current time
     * @param factory Creates a new session when none is usable
     * @param transition Mutates the session; receives whether it was just created
     * @return Transition result
     */
    public <R> R upsertForPhone(String phone,
                                Instant now,
                                Supplier<SignupSession> factory,
                                BiFunction<SignupSession, Boolean, R> transition) {
        List<R> holder = new ArrayList<>(1);
        openSessionByPhone.compute(phone, (key, existingId) -> {
            if (existingId != null) {
                SignupSession[] reused = new SignupSession[1];
                sessions.computeIfPresent(existingId, (id, stored) -> {
                    if (stored.isCompleted() || stored.isExpired(now)) {
                        return stored;
                    }
                    SignupSession working = stored.copy();
                    holder.add(transition.apply(working, false));
                    reused[0] = working;
                    return working;
                });
                if (reused[0] != null) {
                    return existingId;
                }
            }
            SignupSession created = factory.get();
            holder.add(transition.apply(created, true));
            sessions.put(created.getSessionId(), created);
            log.info("Created signup session - sessionId: {}, phone: {}",
                    created.getSessionId(), IdentifierMasker.mask(phone));
            return created.getSessionId();
        });
        return holder.get(0);
    }

    /**
     * Removes the session if it has expired. Runs under the session's key lock,
     * so it waits for a transition in flight and re-checks afterwards.
     *
     * @return true if the session was removed
     */
    public boolean removeIfExpired(String sessionId, Instant now) {
        SignupSession[] removed = new SignupSession[1];
        sessions.computeIfPresent(sessionId, (id, stored) -> {
            if (stored.isExpired(now)) {
                removed[0] = stored;
                return null;
            }
            return stored;
        });
        if (removed[0] == null) {
            return false;
        }
        openSessionByPhone.remove(removed[0].getPhone(), sessionId);
        log.debug("Removed expired session - sessionId: {}, phone: {}",
                sessionId, IdentifierMasker.mask(removed[0].getPhone()));
        return true;
    }

    /**
     * Deletes every session whose expiresAt has passed.
     *
     * @return number of sessions removed
     */
    public int sweepExpired(Instant now) {
        int removed = 0;
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            if (removeIfExpired(sessionId, now)) {
                removed++;
            }
        }
        return removed;
    }

    public Optional<String> findOpenSessionId(String phone) {
        return Optional.ofNullable(openSessionByPhone.get(phone));
    }

    public long count() {
        return sessionCache.estimatedSize();
    }
}
