package com.coinboard.backend.auth.identity.verification.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.coinboard.backend.auth.domain.User;
import com.coinboard.backend.auth.repo.UserRepository;
import com.coinboard.backend.auth.token.support.TokenHashUtils;
import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 이메일 인증 (메일 링크의 token 소비)
 * - 없는 토큰/만료 토큰/이미 쓴 토큰은 모두 VERIFICATION_TOKEN_INVALID
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailVerificationService {

    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional
    public void verify(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new ApiException(ErrorCode.VERIFICATION_TOKEN_INVALID);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = userRepository.findByEmailVerificationTokenHash(TokenHashUtils.sha256Hex(rawToken))
                .orElseThrow(() -> new ApiException(ErrorCode.VERIFICATION_TOKEN_INVALID));

        if (user.isVerificationTokenExpired(now)) {
            throw new ApiException(ErrorCode.VERIFICATION_TOKEN_INVALID);
        }

        user.markEmailVerified(now); // dirty checking
        log.info("Email verified. userId={}", user.getId());
    }
}
