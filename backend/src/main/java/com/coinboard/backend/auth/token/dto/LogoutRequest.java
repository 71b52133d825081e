package com.coinboard.backend.auth.token.dto;

/**
 * 로그아웃 요청
 * - refreshToken이 비었거나 모르는 값이어도 204 (멱등). 그래서 @NotBlank를 걸지 않는다.
 */
public record LogoutRequest(String refreshToken) {}
