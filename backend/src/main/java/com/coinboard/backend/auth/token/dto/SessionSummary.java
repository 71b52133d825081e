package com.coinboard.backend.auth.token.dto;

import java.time.LocalDateTime;

import com.coinboard.backend.auth.token.domain.RefreshSession;

// GET /api/auth/sessions 항목. tokenId는 내보내지 않는다.
public record SessionSummary(
        Long id,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        LocalDateTime lastUsedAt,
        String userAgent,
        String ipAddress
) {
    public static SessionSummary from(RefreshSession s) {
        return new SessionSummary(
                s.getId(),
                s.getCreatedAt(),
                s.getExpiresAt(),
                s.getLastUsedAt(),
                s.getUserAgent(),
                s.getIpAddress());
    }
}
