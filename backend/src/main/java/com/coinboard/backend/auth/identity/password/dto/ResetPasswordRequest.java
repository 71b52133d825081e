package com.coinboard.backend.auth.identity.password.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 비밀번호 재설정 요청
 * - newPassword 강도는 서비스에서 WEAK_PASSWORD로 판단한다.
 */
public record ResetPasswordRequest(
        @NotBlank String token,
        @NotBlank String newPassword
) {}
