package com.coinboard.backend.auth.identity.dto;

import com.coinboard.backend.auth.domain.User;

/**
 * 외부로 내보내는 사용자 정보 (공개 필드만)
 * - passwordHash, 토큰 해시, 잠금 상태 등은 절대 포함하지 않는다.
 */
public record UserResponse(
        Long id,
        String username,
        String email,
        String firstName,
        String lastName,
        boolean verified
) {
    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.isVerified());
    }
}
