package com.coinboard.backend.auth.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "회원 저장소"
 *
 * 가입 흐름:
 * - RegisterService.register()에서 insert (verified=false, 인증 토큰 해시 세팅)
 *
 * 로그인 흐름:
 * - LoginService.login()에서 email로 조회 -> lockedUntil 검사 -> password_hash 비교
 * - 실패 횟수/잠금은 엔티티 setter가 아니라 UserRepository의 단일 UPDATE 문으로만 바꾼다.
 *   (동시 로그인 실패가 read-modify-write로 덮어써지는 것을 막기 위해)
 *
 * 일회용 토큰(이메일 인증/비밀번호 재설정):
 * - 원문은 메일 링크로만 나가고, DB에는 sha256 hex(64)만 저장한다.
 */
@Getter
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uq_users_username", columnNames = "username")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    public static final int TOKEN_HASH_LEN = 64; // sha256 hex

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // PK. JWT의 sub(subject)로 쓰임(userId)

    @Column(nullable = false, length = 255)
    private String email; // 로그인 ID (소문자 정규화, Unique)

    @Column(nullable = false, length = 30)
    private String username; // 표시명 (Unique)

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // BCrypt 해시 (원문 저장 금지)

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR) // MySQL ENUM 대신 VARCHAR 컬럼
    @Column(nullable = false, length = 20)
    private UserRole role; // JWT에 실어서 인가에 씀

    @Column(name = "email_verified_at")
    private LocalDateTime emailVerifiedAt; // null이면 미인증

    @Column(name = "login_attempts", nullable = false)
    private int loginAttempts; // 연속 로그인 실패 횟수

    @Column(name = "locked_until")
    private LocalDateTime lockedUntil; // 이 시각 전까지 로그인 차단

    @Column(name = "email_verification_token_hash", length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String emailVerificationTokenHash;

    @Column(name = "email_verification_expires_at")
    private LocalDateTime emailVerificationExpiresAt;

    @Column(name = "password_reset_token_hash", length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String passwordResetTokenHash;

    @Column(name = "password_reset_expires_at")
    private LocalDateTime passwordResetExpiresAt;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;


    // ========= factory =========

    // 가입 시 생성 (RegisterService.register()에서 호출)
    public static User register(
            String email,
            String username,
            String passwordHash,
            String firstName,
            String lastName,
            String verificationTokenHash,
            LocalDateTime verificationExpiresAt,
            LocalDateTime now
    ) {
        require(email != null && !email.isBlank(), "email must not be blank");
        require(username != null && !username.isBlank(), "username must not be blank");
        require(passwordHash != null && !passwordHash.isBlank(), "passwordHash must not be blank");
        Objects.requireNonNull(now, "now must not be null");

        User u = new User();
        u.email = email;
        u.username = username;
        u.passwordHash = passwordHash;
        u.firstName = firstName;
        u.lastName = lastName;

        // 기본 정책값
        u.role = UserRole.USER;
        u.emailVerifiedAt = null;
        u.loginAttempts = 0;
        u.lockedUntil = null;

        u.emailVerificationTokenHash = verificationTokenHash;
        u.emailVerificationExpiresAt = verificationExpiresAt;
        u.createdAt = now;
        return u;
    }


    // ========= domain =========

    public boolean isVerified() {
        return emailVerifiedAt != null;
    }

    public boolean isLocked(LocalDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean isVerificationTokenExpired(LocalDateTime now) {
        return emailVerificationExpiresAt == null || !emailVerificationExpiresAt.isAfter(now);
    }

    public boolean isPasswordResetTokenExpired(LocalDateTime now) {
        return passwordResetExpiresAt == null || !passwordResetExpiresAt.isAfter(now);
    }

    public void markEmailVerified(LocalDateTime now) {
        this.emailVerifiedAt = now;
        this.emailVerificationTokenHash = null;
        this.emailVerificationExpiresAt = null;
    }

    public void startPasswordReset(String tokenHash, LocalDateTime expiresAt) {
        require(tokenHash != null && tokenHash.length() == TOKEN_HASH_LEN, "tokenHash must be sha256 hex");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        this.passwordResetTokenHash = tokenHash;
        this.passwordResetExpiresAt = expiresAt;
    }

    /**
     * 비밀번호 재설정 완료
     * - 새 해시로 교체 + 재설정 토큰 소비
     * - 잠금 상태도 풀어준다. (메일 소유 증명이 끝났으므로)
     */
    public void completePasswordReset(String newPasswordHash) {
        require(newPasswordHash != null && !newPasswordHash.isBlank(), "passwordHash must not be blank");
        this.passwordHash = newPasswordHash;
        this.passwordResetTokenHash = null;
        this.passwordResetExpiresAt = null;
        this.loginAttempts = 0;
        this.lockedUntil = null;
    }

    public void setLastLoginAt(LocalDateTime now) {
        this.lastLoginAt = now;
    }


    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
