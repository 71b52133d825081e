package com.coinboard.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.coinboard.backend.auth.config.AuthProperties;
import com.coinboard.backend.auth.config.AuthProperties.ReusePolicy;
import com.coinboard.backend.auth.domain.User;
import com.coinboard.backend.auth.repo.UserRepository;
import com.coinboard.backend.auth.support.ClientInfo;
import com.coinboard.backend.auth.token.domain.RefreshSession;
import com.coinboard.backend.auth.token.domain.SessionRevokeReason;
import com.coinboard.backend.auth.token.dto.SessionSummary;
import com.coinboard.backend.auth.token.dto.TokenPair;
import com.coinboard.backend.auth.token.repo.RefreshSessionRepository;
import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;
import com.coinboard.backend.security.JwtService;
import com.coinboard.backend.security.JwtService.IssuedRefresh;
import com.coinboard.backend.security.JwtService.RefreshClaims;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh 세션 발급/로테이션/폐기 서비스
 *
 * - refresh JWT는 서명만으로는 유효하지 않다. jti(tokenId)가 가리키는 세션 row가 살아 있어야 한다.
 * - rotate: old 세션을 ROTATED로 compare-and-revoke 한 뒤 새 쌍을 발급한다.
 * - ROTATED 세션이 다시 제출되면 탈취 신호로 보고 REFRESH_REUSED.
 *   reuse-policy=REVOKE_ALL이면 그 유저의 살아있는 세션을 전부 폐기한다.
 *
 * 동시성:
 * - 같은 refresh로 동시에 들어온 요청은 revokeIfActive(조건부 UPDATE) 결과가 1인 쪽만 성공한다.
 *   0을 받은 쪽은 REFRESH_INVALID. (경쟁에서 진 것뿐이라 전체 폐기는 하지 않는다)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshSessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final JwtService jwtService;
    private final AuthProperties props;
    private final Clock clock;

    // access + refresh 발급, refresh 세션 row 저장 (register/login/rotate 공통)
    @Transactional
    public TokenPair issue(User user, ClientInfo client) {
        if (user == null || user.getId() == null) throw new IllegalArgumentException("user must be persisted");
        return issue(user.getId(), user, client == null ? ClientInfo.UNKNOWN : client);
    }

    private TokenPair issue(Long userId, User user, ClientInfo client) {
        String accessToken = jwtService.issueAccessToken(userId, user.getRole());
        IssuedRefresh refresh = jwtService.issueRefreshToken(userId);

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = LocalDateTime.ofInstant(refresh.expiresAt(), clock.getZone());

        sessionRepository.save(RefreshSession.open(
                userId, refresh.tokenId(), now, expiresAt, client.userAgent(), client.ipAddress()));

        return new TokenPair(accessToken, refresh.token());
    }

    /**
     * refresh 로테이션
     *
     * 실패 순서:
     * 1) 서명/issuer/typ 불일치 → REFRESH_INVALID, exp 지남 → REFRESH_EXPIRED
     * 2) 세션 없음/다른 유저 세션 → REFRESH_INVALID
     * 3) ROTATED → (정책에 따라 전체 폐기) REFRESH_REUSED
     * 4) 그 밖의 revoke → REFRESH_REVOKED, 세션 만료 → REFRESH_EXPIRED
     * 5) compare-and-revoke 0건 → REFRESH_INVALID
     */
    @Transactional(noRollbackFor = RefreshReuseDetectedException.class)
    public TokenPair rotate(String refreshRaw) {
        RefreshClaims claims = verify(refreshRaw);
        LocalDateTime now = LocalDateTime.now(clock);

        RefreshSession session = sessionRepository.findByTokenId(claims.tokenId())
                .filter(s -> s.isOwnedBy(claims.userId()))
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        if (session.isRotated()) {
            handleReuse(session.getUserId(), now);
        }
        if (session.isRevoked()) throw new ApiException(ErrorCode.REFRESH_REVOKED);
        if (session.isExpired(now)) throw new ApiException(ErrorCode.REFRESH_EXPIRED);

        User user = userRepository.findById(session.getUserId())
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        int updated = sessionRepository.revokeIfActive(session.getTokenId(), now, SessionRevokeReason.ROTATED);
        if (updated != 1) {
            log.debug("Refresh rotation lost race. userId={}", session.getUserId());
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        return issue(user.getId(), user, new ClientInfo(session.getUserAgent(), session.getIpAddress()));
    }

    /**
     * 로그아웃 (멱등)
     * - 토큰이 비었거나, 검증 실패거나, 다른 유저 것이거나, 이미 폐기됐으면 아무것도 하지 않는다.
     */
    @Transactional
    public void revokeIfOwned(Long userId, String refreshRaw) {
        if (userId == null || refreshRaw == null || refreshRaw.isBlank()) {
            return;
        }

        RefreshClaims claims;
        try {
            claims = jwtService.verifyRefreshToken(refreshRaw);
        } catch (JwtService.InvalidJwtException e) {
            log.debug("Logout with unusable refresh token ignored. userId={}", userId);
            return;
        }
        if (!userId.equals(claims.userId())) {
            return;
        }

        sessionRepository.revokeIfOwned(claims.tokenId(), userId, LocalDateTime.now(clock), SessionRevokeReason.LOGOUT);
    }

    @Transactional
    public int revokeAll(Long userId, SessionRevokeReason reason) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        int revoked = sessionRepository.revokeAllByUserId(userId, LocalDateTime.now(clock), reason);
        log.info("Sessions revoked. userId={}, reason={}, count={}", userId, reason, revoked);
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<SessionSummary> getActiveSessions(Long userId) {
        return sessionRepository
                .findByUserIdAndRevokedAtIsNullAndExpiresAtAfterOrderByCreatedAtDesc(userId, LocalDateTime.now(clock))
                .stream()
                .map(SessionSummary::from)
                .toList();
    }


    private RefreshClaims verify(String refreshRaw) {
        try {
            return jwtService.verifyRefreshToken(refreshRaw);
        } catch (JwtService.ExpiredJwtTokenException e) {
            throw new ApiException(ErrorCode.REFRESH_EXPIRED);
        } catch (JwtService.InvalidJwtException e) {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }
    }

    private void handleReuse(Long userId, LocalDateTime now) {
        if (props.refresh().reusePolicy() == ReusePolicy.REVOKE_ALL) {
            int revoked = sessionRepository.revokeAllByUserId(userId, now, SessionRevokeReason.REUSE_DETECTED);
            log.warn("Rotated refresh token reused. All sessions revoked. userId={}, count={}", userId, revoked);
        } else {
            log.warn("Rotated refresh token reused. Rejected. userId={}", userId);
        }
        throw new RefreshReuseDetectedException();
    }

    /**
     * 재사용 감지 실패는 예외로 끝나지만 REUSE_DETECTED 폐기는 커밋돼야 한다.
     * rotate()의 noRollbackFor 대상.
     */
    private static class RefreshReuseDetectedException extends ApiException {
        RefreshReuseDetectedException() {
            super(ErrorCode.REFRESH_REUSED);
        }
    }
}
