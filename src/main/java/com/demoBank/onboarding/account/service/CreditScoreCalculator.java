package com.demoBank.onboarding.account.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.Random;

/**
 * Indicative score assigned at account opening, used for pre-approved offers.
 * Not bureau-backed: a base of 500, +50 from age 25, plus a random spread, clamped to 300..900.
 */
@Service
public class CreditScoreCalculator {

    static final int MIN_SCORE = 300;
    static final int MAX_SCORE = 900;
    private static final int BASE_SCORE = 500;
    private static final int MATURITY_AGE = 25;
    private static final int MATURITY_BONUS = 50;
    private static final int SPREAD_LOW = -50;
    private static final int SPREAD_HIGH = 100;

    private final Clock clock;
    private final Random random;

    @Autowired
    public CreditScoreCalculator(Clock clock) {
        this(clock, new SecureRandom());
    }

    CreditScoreCalculator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public int scoreFor(LocalDate dateOfBirth) {
        int score = BASE_SCORE;
        if (dateOfBirth != null && Period.between(dateOfBirth, LocalDate.now(clock)).getYears() >= MATURITY_AGE) {
            score += MATURITY_BONUS;
        }
        score += SPREAD_LOW + random.nextInt(SPREAD_HIGH - SPREAD_LOW + 1);
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
