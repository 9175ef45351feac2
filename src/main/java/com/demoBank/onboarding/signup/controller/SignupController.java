package com.demoBank.onboarding.signup.controller;

import com.demoBank.onboarding.identity.model.IdentityKind;
import com.demoBank.onboarding.signup.dto.IdentityDocumentRequest;
import com.demoBank.onboarding.signup.dto.MobileOtpRequest;
import com.demoBank.onboarding.signup.dto.MobileOtpVerifyRequest;
import com.demoBank.onboarding.signup.dto.OtpCodeRequest;
import com.demoBank.onboarding.signup.dto.PersonalDetailsRequest;
import com.demoBank.onboarding.signup.dto.PinSetupRequest;
import com.demoBank.onboarding.signup.service.VerificationStepMachine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Signup REST controller - thin HTTP layer over the step machine.
 *
 * Request bodies are checked for presence only; every business rule lives in
 * {@link VerificationStepMachine}.
 */
@RestController
@RequestMapping("/api/v1/signup")
@RequiredArgsConstructor
public class SignupController {

    private final VerificationStepMachine stepMachine;

    /**
     * Step 1a - start or resume a signup and send the mobile OTP.
     */
    @PostMapping("/otp")
    public ResponseEntity<?> requestMobileOtp(@Valid @RequestBody MobileOtpRequest request) {
        return StepResponses.toResponse(stepMachine.requestMobileOtp(request.getPhone(), request.getCountryCode()));
    }

    /**
     * Step 1b - confirm the mobile OTP.
     */
    @PostMapping("/otp/verify")
    public ResponseEntity<?> confirmMobileOtp(@Valid @RequestBody MobileOtpVerifyRequest request) {
        return StepResponses.toResponse(stepMachine.confirmMobileOtp(request.getSessionId(), request.getCode()));
    }

    @PostMapping("/{sessionId}/personal-details")
    public ResponseEntity<?> submitPersonalDetails(@PathVariable String sessionId,
                                                   @Valid @RequestBody PersonalDetailsRequest request) {
        return StepResponses.toResponse(stepMachine.submitPersonalDetails(sessionId,
                request.getFullName(), request.getEmail(), request.getDateOfBirth(), request.getGender()));
    }

    @PostMapping("/{sessionId}/primary-id")
    public ResponseEntity<?> requestPrimaryIdOtp(@PathVariable String sessionId,
                                                 @Valid @RequestBody IdentityDocumentRequest request) {
        return StepResponses.toResponse(stepMachine.requestIdOtp(sessionId,
                IdentityKind.PRIMARY, request.getIdentifier(), request.getAddress()));
    }

    @PostMapping("/{sessionId}/primary-id/verify")
    public ResponseEntity<?> confirmPrimaryIdOtp(@PathVariable String sessionId,
                                                 @Valid @RequestBody OtpCodeRequest request) {
        return StepResponses.toResponse(stepMachine.confirmIdOtp(sessionId, IdentityKind.PRIMARY, request.getCode()));
    }

    @PostMapping("/{sessionId}/secondary-id")
    public ResponseEntity<?> requestSecondaryIdOtp(@PathVariable String sessionId,
                                                   @Valid @RequestBody IdentityDocumentRequest request) {
        return StepResponses.toResponse(stepMachine.requestIdOtp(sessionId,
                IdentityKind.SECONDARY, request.getIdentifier(), null));
    }

    @PostMapping("/{sessionId}/secondary-id/verify")
    public ResponseEntity<?> confirmSecondaryIdOtp(@PathVariable String sessionId,
                                                   @Valid @RequestBody OtpCodeRequest request) {
        return StepResponses.toResponse(stepMachine.confirmIdOtp(sessionId, IdentityKind.SECONDARY, request.getCode()));
    }

    /**
     * Step 5 - set the PIN and create the account.
     */
    @PostMapping("/{sessionId}/pin")
    public ResponseEntity<?> setupPin(@PathVariable String sessionId,
                                      @Valid @RequestBody PinSetupRequest request) {
        return StepResponses.toResponse(stepMachine.setupPin(sessionId,
                request.getPin(), request.getConfirmPin(), request.isTermsAccepted()));
    }

    /**
     * Current progress, for resuming a signup.
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<?> describeSession(@PathVariable String sessionId) {
        return StepResponses.toResponse(stepMachine.describeSession(sessionId));
    }
}
