package com.demoBank.onboarding.signup.controller;

import com.demoBank.onboarding.account.controller.AuthController;
import com.demoBank.onboarding.account.service.LoginService;
import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.signup.dto.OtpIssuedResponse;
import com.demoBank.onboarding.signup.dto.StepAdvanceResponse;
import com.demoBank.onboarding.signup.model.SignupError;
import com.demoBank.onboarding.signup.model.SignupErrorCode;
import com.demoBank.onboarding.signup.model.StepResult;
import com.demoBank.onboarding.signup.service.VerificationStepMachine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {SignupController.class, AuthController.class})
@DisplayName("Signup HTTP layer")
class SignupControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VerificationStepMachine stepMachine;

    @MockBean
    private LoginService loginService;

    @Test
    @DisplayName("Should return the session id when the mobile OTP is sent")
    void shouldRequestMobileOtp() throws Exception {
        when(stepMachine.requestMobileOtp("9876543210", null)).thenReturn(StepResult.ok(
                OtpIssuedResponse.builder().sessionId("s-1").expiresInSeconds(300).sentTo("+91 98765 43210").build()));

        mockMvc.perform(post("/api/v1/signup/otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"9876543210\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.expiresInSeconds").value(300));
    }

    @Test
    @DisplayName("Should reject a body without the required fields before reaching the step machine")
    void shouldRejectMissingFields() throws Exception {
        mockMvc.perform(post("/api/v1/signup/otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors.phone").value("phone is required"));

        verifyNoInteractions(stepMachine);
    }

    @Test
    @DisplayName("Should pass parsed personal details to the step machine")
    void shouldSubmitPersonalDetails() throws Exception {
        when(stepMachine.submitPersonalDetails(eq("s-1"), anyString(), anyString(), any(), anyString()))
                .thenReturn(StepResult.ok(StepAdvanceResponse.builder().sessionId("s-1").nextStep(3).build()));

        mockMvc.perform(post("/api/v1/signup/s-1/personal-details")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fullName\":\"John Doe\",\"email\":\"john@example.com\","
                                + "\"dateOfBirth\":\"1990-01-15\",\"gender\":\"M\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nextStep").value(3))
                .andExpect(jsonPath("$.maskedIdentifier").doesNotExist());

        verify(stepMachine).submitPersonalDetails("s-1", "John Doe", "john@example.com", LocalDate.of(1990, 1, 15), "M");
    }

    @Test
    @DisplayName("Should map an identity mismatch to 422 with the differing fields")
    void shouldMapMismatch() throws Exception {
        when(stepMachine.requestIdOtp("s-1", IdentityKind.PRIMARY, "123456789012", "Mumbai"))
                .thenReturn(StepResult.fail(SignupError.mismatch(List.of("fullName"))));

        mockMvc.perform(post("/api/v1/signup/s-1/primary-id")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"123456789012\",\"address\":\"Mumbai\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("IDENTITY_MISMATCH"))
                .andExpect(jsonPath("$.mismatchedFields[0]").value("fullName"));
    }

    @Test
    @DisplayName("Should ignore the address on the secondary ID")
    void shouldDropAddressForSecondaryId() throws Exception {
        when(stepMachine.requestIdOtp("s-1", IdentityKind.SECONDARY, "ABCDE1234F", null))
                .thenReturn(StepResult.fail(SignupErrorCode.PRECONDITION_NOT_MET));

        mockMvc.perform(post("/api/v1/signup/s-1/secondary-id")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"ABCDE1234F\",\"address\":\"ignored\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("PRECONDITION"));
    }

    @Test
    @DisplayName("Should return 429 with Retry-After when sends are throttled")
    void shouldMapRateLimit() throws Exception {
        when(stepMachine.requestMobileOtp("9876543210", "+91"))
                .thenReturn(StepResult.fail(SignupError.rateLimited(SignupErrorCode.OTP_SEND_LIMIT, 120)));

        mockMvc.perform(post("/api/v1/signup/otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"9876543210\",\"countryCode\":\"+91\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "120"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(120));
    }

    @Test
    @DisplayName("Should report attempts left on a wrong OTP")
    void shouldMapWrongOtp() throws Exception {
        when(stepMachine.confirmMobileOtp("s-1", "000000"))
                .thenReturn(StepResult.fail(SignupError.withAttemptsLeft(SignupErrorCode.WRONG_OTP, 2)));

        mockMvc.perform(post("/api/v1/signup/otp/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s-1\",\"code\":\"000000\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("WRONG_OTP"))
                .andExpect(jsonPath("$.attemptsLeft").value(2));
    }

    @Test
    @DisplayName("Should return 404 for an unknown session")
    void shouldMapUnknownSession() throws Exception {
        when(stepMachine.describeSession("missing")).thenReturn(StepResult.fail(SignupErrorCode.SESSION_NOT_FOUND));

        mockMvc.perform(get("/api/v1/signup/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    @DisplayName("Should return 401 for a wrong PIN at login")
    void shouldMapWrongPin() throws Exception {
        when(loginService.login("9876543210", "111222"))
                .thenReturn(StepResult.fail(SignupError.withAttemptsLeft(SignupErrorCode.WRONG_PIN, 1)));

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone\":\"9876543210\",\"pin\":\"111222\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.attemptsLeft").value(1));
    }

    @Test
    @DisplayName("Should hide unexpected failures behind a generic 500")
    void shouldMapUnexpectedFailure() throws Exception {
        when(stepMachine.describeSession("boom")).thenThrow(new IllegalStateException("internal detail"));

        mockMvc.perform(get("/api/v1/signup/boom"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
