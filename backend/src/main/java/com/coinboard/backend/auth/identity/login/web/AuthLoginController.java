package com.coinboard.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.identity.dto.AuthResponse;
import com.coinboard.backend.auth.identity.login.dto.LoginRequest;
import com.coinboard.backend.auth.identity.login.service.LoginService;
import com.coinboard.backend.auth.support.ClientInfo;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST /api/auth/login
 * - 응답: {user, tokens{accessToken, refreshToken}}
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthLoginController {

    private final LoginService loginService;

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        return loginService.login(req.email(), req.password(), ClientInfo.from(request));
    }
}
