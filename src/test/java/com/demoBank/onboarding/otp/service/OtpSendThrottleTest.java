package com.demoBank.onboarding.otp.service;

import com.demoBank.onboarding.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OtpSendThrottle")
class OtpSendThrottleTest {

    private MutableClock clock;
    private OtpSendThrottle throttle;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-10T10:00:00Z"));
        throttle = new OtpSendThrottle(clock, 3, 600);
    }

    @Test
    @DisplayName("Should allow sends up to the limit, then report when to retry")
    void shouldLimitSendsPerWindow() {
        assertThat(throttle.tryAcquire("9876543210")).isZero();
        clock.advance(Duration.ofSeconds(60));
        assertThat(throttle.tryAcquire("9876543210")).isZero();
        assertThat(throttle.tryAcquire("9876543210")).isZero();

        assertThat(throttle.tryAcquire("9876543210")).isEqualTo(540);
        assertThat(throttle.tryAcquire("9123456789")).isZero();
    }

    @Test
    @DisplayName("Should free capacity as sends leave the window")
    void shouldSlideWindow() {
        for (int i = 0; i < 3; i++) {
            throttle.tryAcquire("9876543210");
        }

        clock.advance(Duration.ofSeconds(601));

        assertThat(throttle.tryAcquire("9876543210")).isZero();
    }

    @Test
    @DisplayName("Should drop idle windows without losing active ones")
    void shouldEvictIdleWindows() {
        for (int i = 0; i < 3; i++) {
            throttle.tryAcquire("9876543210");
        }
        clock.advance(Duration.ofSeconds(601));
        throttle.evictIdle();

        assertThat(throttle.tryAcquire("9876543210")).isZero();
    }

    @Test
    @DisplayName("Should count every send while idle windows are evicted concurrently")
    void shouldNotLoseSendsDuringEviction() throws Exception {
        int phones = 2000;
        AtomicInteger allowed = new AtomicInteger();
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            Future<?> evictor = executor.submit(() -> {
                while (running.get()) {
                    throttle.evictIdle();
                }
            });
            List<Future<?>> senders = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                senders.add(executor.submit(() -> {
                    for (int i = 0; i < phones; i++) {
                        if (throttle.tryAcquire("9" + (100_000_000 + i)) == 0) {
                            allowed.incrementAndGet();
                        }
                    }
                }));
            }
            for (Future<?> sender : senders) {
                sender.get();
            }
            running.set(false);
            evictor.get();
        } finally {
            executor.shutdownNow();
        }

        assertThat(allowed.get()).isEqualTo(3 * phones);
    }
}
