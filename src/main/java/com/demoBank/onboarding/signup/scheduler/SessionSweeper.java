package com.demoBank.onboarding.signup.scheduler;

import com.demoBank.onboarding.otp.service.OtpSendThrottle;
import com.demoBank.onboarding.signup.repository.SignupSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Background cleanup of expired signup sessions and idle OTP send windows.
 * Transitions never rely on it: every step re-checks expiry itself.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionSweeper {

    private final SignupSessionStore sessionStore;
    private final OtpSendThrottle sendThrottle;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${onboarding.session.sweep-interval-ms:60000}",
            initialDelayString = "${onboarding.session.sweep-interval-ms:60000}")
    public void sweepExpiredSessions() {
        try {
            int removed = sessionStore.sweepExpired(clock.instant());
            sendThrottle.evictIdle();
            if (removed > 0) {
                log.info("Expired signup sessions removed - count: {}, remaining: {}", removed, sessionStore.count());
            }
        } catch (Exception e) {
            log.error("Error sweeping expired signup sessions", e);
        }
    }
}
