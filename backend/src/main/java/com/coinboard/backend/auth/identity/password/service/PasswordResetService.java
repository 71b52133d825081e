package com.coinboard.backend.auth.identity.password.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.coinboard.backend.auth.config.AuthProperties;
import com.coinboard.backend.auth.domain.User;
import com.coinboard.backend.auth.mail.event.PasswordResetMailRequestedEvent;
import com.coinboard.backend.auth.repo.UserRepository;
import com.coinboard.backend.auth.support.AuthPatterns;
import com.coinboard.backend.auth.support.EmailUtils;
import com.coinboard.backend.auth.support.PasswordHasher;
import com.coinboard.backend.auth.token.domain.SessionRevokeReason;
import com.coinboard.backend.auth.token.service.RefreshTokenService;
import com.coinboard.backend.auth.token.support.TokenGenerator;
import com.coinboard.backend.auth.token.support.TokenHashUtils;
import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 찾기/재설정
 *
 * forgot:
 * - 가입 여부와 관계없이 호출자는 같은 결과를 받는다. (계정 존재 여부 노출 금지)
 * - 있으면 재설정 토큰 발급(해시만 저장, 이전 토큰은 덮어씀) + 커밋 후 메일
 *
 * reset:
 * - 토큰 row를 FOR UPDATE로 잡아 같은 토큰의 동시 사용을 한 번으로 제한한다.
 * - 새 해시 저장, 토큰 소비, 로그인 잠금 해제, 모든 refresh 세션 폐기(PASSWORD_RESET)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenGenerator tokenGenerator;
    private final RefreshTokenService refreshTokenService;
    private final ApplicationEventPublisher eventPublisher;
    private final AuthProperties props;
    private final Clock clock;

    @Transactional
    public void forgotPassword(String rawEmail) {
        String email = EmailUtils.normalize(rawEmail);
        if (email == null || email.isBlank()) {
            return;
        }

        userRepository.findByEmail(email).ifPresentOrElse(user -> {
            String rawToken = tokenGenerator.generateOneTimeToken();
            LocalDateTime expiresAt = LocalDateTime.now(clock).plusMinutes(props.emailToken().resetTtlMinutes());

            user.startPasswordReset(TokenHashUtils.sha256Hex(rawToken), expiresAt);
            eventPublisher.publishEvent(new PasswordResetMailRequestedEvent(user.getEmail(), rawToken));
            log.info("Password reset requested. userId={}", user.getId());
        }, () -> log.debug("Password reset requested for unknown email={}", EmailUtils.mask(email)));
    }

    @Transactional
    public void resetPassword(String rawToken, String newPassword) {
        if (!AuthPatterns.isAcceptablePassword(newPassword)) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD);
        }
        if (rawToken == null || rawToken.isBlank()) {
            throw new ApiException(ErrorCode.RESET_TOKEN_INVALID);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = userRepository.findByPasswordResetTokenHashForUpdate(TokenHashUtils.sha256Hex(rawToken))
                .orElseThrow(() -> new ApiException(ErrorCode.RESET_TOKEN_INVALID));

        if (user.isPasswordResetTokenExpired(now)) {
            throw new ApiException(ErrorCode.RESET_TOKEN_INVALID);
        }

        user.completePasswordReset(passwordHasher.hash(newPassword));

        refreshTokenService.revokeAll(user.getId(), SessionRevokeReason.PASSWORD_RESET);
        log.info("Password reset completed. userId={}", user.getId());
    }
}
