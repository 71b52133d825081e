package com.coinboard.backend.auth.identity.verification.web;

import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.identity.dto.MessageResponse;
import com.coinboard.backend.auth.identity.verification.service.EmailVerificationService;

import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;

// GET /api/auth/verify-email?token=...
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthVerificationController {

    static final String VERIFIED_MESSAGE = "Email verified successfully";

    private final EmailVerificationService verificationService;

    @GetMapping("/verify-email")
    public MessageResponse verifyEmail(@RequestParam("token") @NotBlank String token) {
        verificationService.verify(token);
        return new MessageResponse(VERIFIED_MESSAGE);
    }
}
