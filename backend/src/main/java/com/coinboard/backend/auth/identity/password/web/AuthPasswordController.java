package com.coinboard.backend.auth.identity.password.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.identity.dto.MessageResponse;
import com.coinboard.backend.auth.identity.password.dto.ForgotPasswordRequest;
import com.coinboard.backend.auth.identity.password.dto.ResetPasswordRequest;
import com.coinboard.backend.auth.identity.password.service.PasswordResetService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST /api/auth/forgot-password: 항상 같은 200 메시지
 * POST /api/auth/reset-password
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthPasswordController {

    static final String FORGOT_MESSAGE = "If that email is registered, a password reset link has been sent";
    static final String RESET_MESSAGE = "Password has been reset successfully";

    private final PasswordResetService passwordResetService;

    @PostMapping("/forgot-password")
    public MessageResponse forgotPassword(@Valid @RequestBody ForgotPasswordRequest req) {
        passwordResetService.forgotPassword(req.email());
        return new MessageResponse(FORGOT_MESSAGE);
    }

    @PostMapping("/reset-password")
    public MessageResponse resetPassword(@Valid @RequestBody ResetPasswordRequest req) {
        passwordResetService.resetPassword(req.token(), req.newPassword());
        return new MessageResponse(RESET_MESSAGE);
    }
}
