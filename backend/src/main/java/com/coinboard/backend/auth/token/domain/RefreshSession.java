package com.coinboard.backend.auth.token.domain;

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
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_sessions 테이블 매핑 엔티티 (서버가 관리하는 로그인 세션)
 *
 * - Access Token(JWT)은 서버에 저장하지 않음(Stateless)
 * - Refresh Token(JWT)은 서명만으로는 유효하지 않다. jti(tokenId)가 살아있는 세션 row를 가리켜야 한다.
 *
 * 핵심 불변 조건(invariants):
 * 1) refresh가 유효하려면 revoked_at IS NULL AND expires_at > now
 * 2) 로테이션 시 기존 row는 ROTATED로 revoke되고 새 row가 생긴다. (토큰 하나당 row 하나)
 * 3) revoke는 항상 "revoked_at IS NULL" 조건부 UPDATE로만 한다. (RefreshSessionRepository)
 *
 * 인덱스:
 * - idx_refresh_sessions_token_id: refresh JWT의 jti로 조회 (unique)
 * - idx_refresh_sessions_user_id: 유저 단위 세션 목록/전체 폐기
 */
@Getter
@Entity
@Table(
    name = "refresh_sessions",
    indexes = {
        @Index(name = "idx_refresh_sessions_token_id", columnList = "token_id", unique = true),
        @Index(name = "idx_refresh_sessions_user_id", columnList = "user_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RefreshSession {

    public static final int TOKEN_ID_MAX = 64;
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token_id", nullable = false, length = TOKEN_ID_MAX)
    private String tokenId; // refresh JWT의 jti (비밀값 아님)

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    // ---- ops / security telemetry ----
    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR) // MySQL ENUM 대신 VARCHAR 컬럼
    @Column(name = "revoke_reason", length = 50)
    private SessionRevokeReason revokeReason;

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt; // 발급 시각(issuedAt)


    // ========= factory =========

    // 발급 팩토리 메서드 (RefreshTokenService.issue)
    public static RefreshSession open(
            Long userId,
            String tokenId,
            LocalDateTime now,
            LocalDateTime expiresAt,
            String userAgent,
            String ipAddress
    ) {
        require(userId != null, "userId must not be null");
        require(tokenId != null && !tokenId.isBlank(), "tokenId must not be blank");
        require(tokenId.length() <= TOKEN_ID_MAX, "tokenId too long");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");
        require(expiresAt.isAfter(now), "expiresAt must be after now");

        RefreshSession s = new RefreshSession();
        s.userId = userId;
        s.tokenId = tokenId;
        s.createdAt = now;
        s.expiresAt = expiresAt;
        s.userAgent = trimToNullAndMax(userAgent, USER_AGENT_MAX);
        s.ipAddress = trimToNullAndMax(ipAddress, IP_ADDRESS_MAX);
        return s;
    }


    // ========= domain =========
    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return !expiresAt.isAfter(now);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isRotated() {
        return revokeReason == SessionRevokeReason.ROTATED;
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId.equals(candidateUserId);
    }


    // ========= helpers =========
    private static String trimToNullAndMax(String v, int max) {
        if (v == null) return null;
        String t = v.trim();
        if (t.isEmpty()) return null;
        return t.length() <= max ? t : t.substring(0, max);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
