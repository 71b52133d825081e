package com.coinboard.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.token.dto.RefreshRequest;
import com.coinboard.backend.auth.token.dto.TokenPair;
import com.coinboard.backend.auth.token.service.RefreshTokenService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST /api/auth/refresh
 *
 * - 바디의 refreshToken으로 로테이션하고 새 쌍을 돌려준다.
 * - 실패(INVALID/EXPIRED/REUSED/REVOKED)는 서비스가 ApiException으로 던진다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthTokenController {

    private final RefreshTokenService refreshTokenService;

    @PostMapping("/refresh")
    public TokenPair refresh(@Valid @RequestBody RefreshRequest req) {
        return refreshTokenService.rotate(req.refreshToken());
    }
}
