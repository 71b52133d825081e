package com.coinboard.backend.auth.token.dto;

/**
 * 토큰 쌍 응답
 * - accessToken: Authorization: Bearer 로 사용 (짧은 수명)
 * - refreshToken: POST /api/auth/refresh 바디로만 사용 (서버 세션과 1:1)
 */
public record TokenPair(String accessToken, String refreshToken) {}
