package com.coinboard.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.token.domain.SessionRevokeReason;
import com.coinboard.backend.auth.token.dto.LogoutRequest;
import com.coinboard.backend.auth.token.service.RefreshTokenService;
import com.coinboard.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * POST /api/auth/logout, /api/auth/logout-all (Bearer 필요)
 *
 * - logout: 본인 refresh 세션 하나만 폐기. 바디 없음/모르는 토큰/이미 폐기 → 그래도 204
 * - logout-all: 본인의 살아있는 세션 전부 폐기
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthLogoutController {

    private final RefreshTokenService refreshTokenService;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@AuthenticationPrincipal AuthPrincipal principal,
                       @RequestBody(required = false) LogoutRequest req) {
        String refreshRaw = (req == null) ? null : req.refreshToken();
        refreshTokenService.revokeIfOwned(principal.userId(), refreshRaw);
    }

    @PostMapping("/logout-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logoutAll(@AuthenticationPrincipal AuthPrincipal principal) {
        refreshTokenService.revokeAll(principal.userId(), SessionRevokeReason.LOGOUT_ALL);
    }
}
