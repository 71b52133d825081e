package com.coinboard.backend.auth.token.web;

import java.util.List;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.coinboard.backend.auth.token.dto.SessionSummary;
import com.coinboard.backend.auth.token.service.RefreshTokenService;
import com.coinboard.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

// GET /api/auth/sessions: 살아있는 로그인 세션 목록 (최신순)
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthSessionController {

    private final RefreshTokenService refreshTokenService;

    @GetMapping("/sessions")
    public List<SessionSummary> sessions(@AuthenticationPrincipal AuthPrincipal principal) {
        return refreshTokenService.getActiveSessions(principal.userId());
    }
}
