package com.coinboard.backend.auth.identity.register.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.coinboard.backend.auth.config.AuthProperties;
import com.coinboard.backend.auth.domain.User;
import com.coinboard.backend.auth.identity.dto.AuthResponse;
import com.coinboard.backend.auth.identity.dto.UserResponse;
import com.coinboard.backend.auth.mail.event.VerificationMailRequestedEvent;
import com.coinboard.backend.auth.repo.UserRepository;
import com.coinboard.backend.auth.support.AuthPatterns;
import com.coinboard.backend.auth.support.ClientInfo;
import com.coinboard.backend.auth.support.EmailUtils;
import com.coinboard.backend.auth.support.PasswordHasher;
import com.coinboard.backend.auth.token.dto.TokenPair;
import com.coinboard.backend.auth.token.service.RefreshTokenService;
import com.coinboard.backend.auth.token.support.TokenGenerator;
import com.coinboard.backend.auth.token.support.TokenHashUtils;
import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 회원가입 유스케이스
 *
 * 1) email(trim+소문자)/username(trim) 정규화 후 중복 검사
 * 2) 비밀번호 정책 (WEAK_PASSWORD)
 * 3) BCrypt 해시 + 이메일 인증 토큰(해시만 저장) 생성 후 insert
 * 4) 커밋 후 인증 메일 (VerificationMailRequestedEvent)
 * 5) 가입 즉시 로그인 상태: access + refresh 발급
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegisterService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenGenerator tokenGenerator;
    private final RefreshTokenService refreshTokenService;
    private final ApplicationEventPublisher eventPublisher;
    private final AuthProperties props;
    private final Clock clock;

    @Transactional
    public AuthResponse register(
            String rawUsername,
            String rawEmail,
            String rawPassword,
            String firstName,
            String lastName,
            ClientInfo client
    ) {
        String email = EmailUtils.normalize(rawEmail);
        String username = rawUsername == null ? null : rawUsername.trim();
        LocalDateTime now = LocalDateTime.now(clock);

        if (userRepository.existsByEmail(email)) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
        if (userRepository.existsByUsername(username)) {
            throw new ApiException(ErrorCode.USERNAME_ALREADY_EXISTS);
        }
        if (!AuthPatterns.isAcceptablePassword(rawPassword)) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD);
        }

        String passwordHash = passwordHasher.hash(rawPassword);

        String verificationToken = tokenGenerator.generateOneTimeToken();
        LocalDateTime verificationExpiresAt = now.plusHours(props.emailToken().verificationTtlHours());

        User user = User.register(
                email,
                username,
                passwordHash,
                firstName,
                lastName,
                TokenHashUtils.sha256Hex(verificationToken),
                verificationExpiresAt,
                now);

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 동시 가입 레이스: 선검사는 통과했지만 unique 제약(uq_users_email/uq_users_username)에 걸림
            if (userRepository.existsByEmail(email)) {
                throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
            }
            if (userRepository.existsByUsername(username)) {
                throw new ApiException(ErrorCode.USERNAME_ALREADY_EXISTS);
            }
            throw e;
        }

        eventPublisher.publishEvent(new VerificationMailRequestedEvent(email, username, verificationToken));

        TokenPair tokens = refreshTokenService.issue(user, client);
        log.info("User registered. userId={}, email={}", user.getId(), EmailUtils.mask(email));
        return new AuthResponse(UserResponse.from(user), tokens);
    }
}
