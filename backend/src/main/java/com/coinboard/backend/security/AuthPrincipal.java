package com.coinboard.backend.security;

import com.coinboard.backend.auth.domain.UserRole;

/**
 * SecurityContext에 저장되는 인증 주체
 * - JwtAuthenticationFilter가 access 토큰 검증 성공 시 만든다.
 * - 컨트롤러는 @AuthenticationPrincipal AuthPrincipal 로 꺼낸다.
 */
public record AuthPrincipal(Long userId, UserRole role) {

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");
    }

    public String authority() {
        return "ROLE_" + role.name();
    }
}
