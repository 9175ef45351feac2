package com.demoBank.onboarding.account.controller;

import com.demoBank.onboarding.account.dto.LoginRequest;
import com.demoBank.onboarding.account.service.LoginService;
import com.demoBank.onboarding.signup.controller.StepResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final LoginService loginService;

    /**
     * Phone + PIN login. Wrong PINs count towards the lockout.
     */
    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        return StepResponses.toResponse(loginService.login(request.getPhone(), request.getPin()));
    }
}
