package com.demoBank.onboarding.account.service;

import com.demoBank.onboarding.account.dto.LoginResponse;
import com.demoBank.onboarding.account.model.BankAccount;
import com.demoBank.onboarding.account.model.UserAccount;
import com.demoBank.onboarding.account.repository.AccountRepository;
import com.demoBank.onboarding.signup.model.SignupErrorCode;
import com.demoBank.onboarding.signup.model.StepResult;
import com.demoBank.onboarding.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoginService")
class LoginServiceTest {

    private MutableClock clock;
    private LoginService loginService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-10T10:00:00Z"));
        AccountRepository repository = new AccountRepository();
        PinSecurity pinSecurity = new PinSecurity(new BCryptPasswordEncoder(4), 3, 15);

        UserAccount user = UserAccount.builder()
                .handle("jd3210")
                .phone("9876543210")
                .customerId(12345)
                .fullName("John Doe")
                .build();
        pinSecurity.setPin(user, "482917", clock.instant());
        repository.saveNew(user, BankAccount.builder().accountNumber("1234567890").ownerHandle("jd3210").build());

        loginService = new LoginService(repository, pinSecurity, clock);
    }

    @Test
    @DisplayName("Should log in with the right PIN")
    void shouldLogIn() {
        StepResult<LoginResponse> result = loginService.login("98765 43210", "482917");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getAccountHandle()).isEqualTo("jd3210");
        assertThat(result.getValue().getAccountNumbers()).containsExactly("1234567890");
    }

    @Test
    @DisplayName("Should lock the account after three wrong PINs and report when to retry")
    void shouldLockAfterWrongPins() {
        StepResult<LoginResponse> first = loginService.login("9876543210", "111222");
        loginService.login("9876543210", "111222");
        StepResult<LoginResponse> third = loginService.login("9876543210", "111222");
        StepResult<LoginResponse> locked = loginService.login("9876543210", "482917");

        assertThat(first.getError().getCode()).isEqualTo(SignupErrorCode.WRONG_PIN);
        assertThat(first.getError().getAttemptsLeft()).isEqualTo(2);
        assertThat(third.getError().getAttemptsLeft()).isZero();
        assertThat(locked.getError().getCode()).isEqualTo(SignupErrorCode.PIN_LOCKED);
        assertThat(locked.getError().getRetryAfterSeconds()).isEqualTo(900);

        clock.advance(Duration.ofMinutes(15));
        assertThat(loginService.login("9876543210", "482917").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should report unknown phones and malformed input")
    void shouldReportBadInput() {
        assertThat(loginService.login("9000000000", "482917").getError().getCode())
                .isEqualTo(SignupErrorCode.ACCOUNT_NOT_FOUND);
        assertThat(loginService.login("12", "482917").getError().getCode())
                .isEqualTo(SignupErrorCode.INVALID_PHONE);
        assertThat(loginService.login("9876543210", "12ab").getError().getFieldErrors())
                .containsOnlyKeys("pin");
    }
}
