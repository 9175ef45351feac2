package com.demoBank.onboarding.account.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CreditScoreCalculator")
class CreditScoreCalculatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-10T10:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Should add the maturity bonus from age 25")
    void shouldRewardMaturity() {
        int younger = new CreditScoreCalculator(CLOCK, new Random(3)).scoreFor(LocalDate.of(2002, 1, 11));
        int older = new CreditScoreCalculator(CLOCK, new Random(3)).scoreFor(LocalDate.of(2001, 1, 10));

        assertThat(older - younger).isEqualTo(50);
    }

    @Test
    @DisplayName("Should stay within the score range")
    void shouldStayInRange() {
        CreditScoreCalculator calculator = new CreditScoreCalculator(CLOCK, new Random(11));

        for (int i = 0; i < 200; i++) {
            assertThat(calculator.scoreFor(LocalDate.of(1990, 1, 15)))
                    .isBetween(CreditScoreCalculator.MIN_SCORE, CreditScoreCalculator.MAX_SCORE)
                    .isBetween(500, 650);
        }
    }
}
