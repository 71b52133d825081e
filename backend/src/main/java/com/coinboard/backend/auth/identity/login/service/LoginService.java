package com.coinboard.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.coinboard.backend.auth.config.AuthProperties;
import com.coinboard.backend.auth.domain.User;
import com.coinboard.backend.auth.identity.dto.AuthResponse;
import com.coinboard.backend.auth.identity.dto.UserResponse;
import com.coinboard.backend.auth.repo.UserRepository;
import com.coinboard.backend.auth.support.ClientInfo;
import com.coinboard.backend.auth.support.EmailUtils;
import com.coinboard.backend.auth.support.PasswordHasher;
import com.coinboard.backend.auth.token.dto.TokenPair;
import com.coinboard.backend.auth.token.service.RefreshTokenService;
import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 *
 * 계약:
 * - "이메일 없음"과 "비밀번호 불일치"는 같은 INVALID_CREDENTIALS. (없는 이메일도 dummyVerify로 BCrypt 비용을 쓴다)
 * - lockedUntil이 미래면 ACCOUNT_LOCKED(423) + retryAfterSeconds
 * - 비밀번호 실패는 카운터 +1, maxAttempts 도달 시 lockMinutes 동안 잠근다.
 *   이 UPDATE들은 요청이 401로 끝나도 커밋돼야 하므로 InvalidCredentialsException은 noRollbackFor 대상이다.
 * - 성공 시 카운터/잠금 초기화, lastLoginAt 기록, access + refresh 발급
 *
 * 미인증(emailVerifiedAt == null) 계정도 로그인은 허용한다. 응답의 verified로 구분한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final RefreshTokenService refreshTokenService;
    private final AuthProperties props;
    private final Clock clock;

    @Transactional(noRollbackFor = InvalidCredentialsException.class)
    public AuthResponse login(String rawEmail, String rawPassword, ClientInfo client) {
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new InvalidCredentialsException();
        }

        String email = EmailUtils.normalize(rawEmail);
        LocalDateTime now = LocalDateTime.now(clock);

        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null) {
            passwordHasher.dummyVerify(rawPassword);
            throw new InvalidCredentialsException();
        }

        if (user.isLocked(now)) {
            throw new ApiException(ErrorCode.ACCOUNT_LOCKED, retryAfterSeconds(now, user.getLockedUntil()));
        }

        // 잠금 창이 지났으면 0부터 다시 센다.
        userRepository.clearExpiredLock(user.getId(), now);

        if (!passwordHasher.verify(rawPassword, user.getPasswordHash())) {
            recordFailure(user.getId(), now);
            throw new InvalidCredentialsException();
        }

        userRepository.markLoginSucceeded(user.getId(), now);

        // @Modifying(clearAutomatically)로 영속성 컨텍스트가 비워졌으니 최신 상태로 다시 읽는다.
        User fresh = userRepository.findById(user.getId())
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        TokenPair tokens = refreshTokenService.issue(fresh, client);
        return new AuthResponse(UserResponse.from(fresh), tokens);
    }

    private void recordFailure(Long userId, LocalDateTime now) {
        AuthProperties.Lockout lockout = props.lockout();

        userRepository.incrementLoginAttempts(userId);
        int locked = userRepository.lockIfAttemptsReached(
                userId,
                lockout.maxAttempts(),
                now.plusMinutes(lockout.lockMinutes()),
                now);

        if (locked == 1) {
            log.info("Account locked after repeated login failures. userId={}, minutes={}", userId, lockout.lockMinutes());
        }
    }

    // 최소 1초 (0으로 내려가면 클라이언트가 바로 재시도한다)
    private static int retryAfterSeconds(LocalDateTime now, LocalDateTime lockedUntil) {
        long millis = Duration.between(now, lockedUntil).toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * 실패 카운터/잠금 UPDATE를 롤백시키지 않기 위한 전용 타입
     * - 응답은 일반 INVALID_CREDENTIALS와 동일하다.
     */
    private static class InvalidCredentialsException extends ApiException {
        InvalidCredentialsException() {
            super(ErrorCode.INVALID_CREDENTIALS);
        }
    }
}
