package com.coinboard.backend.auth.identity.register.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.identity.dto.AuthResponse;
import com.coinboard.backend.auth.identity.register.dto.RegisterRequest;
import com.coinboard.backend.auth.identity.register.service.RegisterService;
import com.coinboard.backend.auth.support.ClientInfo;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

// POST /api/auth/register: 201 {user, tokens}
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthRegisterController {

    private final RegisterService registerService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public AuthResponse register(@Valid @RequestBody RegisterRequest req, HttpServletRequest request) {
        return registerService.register(
                req.username(),
                req.email(),
                req.password(),
                req.firstName(),
                req.lastName(),
                ClientInfo.from(request));
    }
}
