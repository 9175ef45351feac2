package com.demoBank.onboarding.otp.service;

import com.demoBank.onboarding.util.IdentifierMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window limit on how many OTPs may be issued to one phone.
 *
 * In-memory per instance; a shared store would be needed behind a load balancer.
 */
@Slf4j
@Service
public class OtpSendThrottle {

    private final Clock clock;
    private final int maxSends;
    private final Duration window;

    // phone -> timestamps of recent sends
    private final Map<String, SendWindow> phoneWindows = new ConcurrentHashMap<>();

    public OtpSendThrottle(Clock clock,
                           @Value("${onboarding.otp.send-limit:5}") int maxSends,
                           @Value("${onboarding.otp.send-window-seconds:600}") long windowSeconds) {
        this.clock = clock;
        this.maxSends = maxSends;
        this.window = Duration.ofSeconds(windowSeconds);
    }

    /**
     * Records a send for the phone if the limit allows it.
     *
     * @param phone Digits-only phone number
     * @return 0 if the send is allowed, otherwise seconds until the oldest send leaves the window
     */
    public long tryAcquire(String phone) {
        Instant now = clock.instant();
        long[] retryAfterHolder = new long[1];
        // recorded inside compute so a concurrent evictIdle cannot drop the window mid-send
        phoneWindows.compute(phone, (key, sendWindow) -> {
            SendWindow current = sendWindow == null ? new SendWindow() : sendWindow;
            retryAfterHolder[0] = current.tryAdd(now, now.minus(window), maxSends, window);
            return current;
        });
        long retryAfter = retryAfterHolder[0];
        if (retryAfter > 0) {
            log.warn("OTP send limit exceeded - phone: {}, retryAfterSeconds: {}",
                    IdentifierMasker.mask(phone), retryAfter);
        }
        return retryAfter;
    }

    /**
     * Drops windows that no longer hold any send.
     */
    public void evictIdle() {
        Instant cutoff = clock.instant().minus(window);
        for (String phone : phoneWindows.keySet()) {
            phoneWindows.computeIfPresent(phone, (key, sendWindow) -> sendWindow.isIdle(cutoff) ? null : sendWindow);
        }
    }

    private static class SendWindow {
        private final List<Instant> sends = new ArrayList<>();

        synchronized long tryAdd(Instant now, Instant cutoff, int maxSends, Duration window) {
            sends.removeIf(timestamp -> !timestamp.isAfter(cutoff));
            if (sends.size() >= maxSends) {
                Instant oldest = sends.get(0);
                return Math.max(1, Duration.between(now, oldest.plus(window)).toSeconds());
            }
            sends.add(now);
            return 0;
        }

        synchronized boolean isIdle(Instant cutoff) {
            sends.removeIf(timestamp -> !timestamp.isAfter(cutoff));
            return sends.isEmpty();
        }
    }
}
