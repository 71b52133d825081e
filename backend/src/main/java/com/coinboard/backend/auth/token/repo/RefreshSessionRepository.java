package com.coinboard.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.coinboard.backend.auth.token.domain.RefreshSession;
import com.coinboard.backend.auth.token.domain.SessionRevokeReason;

@Repository
public interface RefreshSessionRepository extends JpaRepository<RefreshSession, Long> {

    Optional<RefreshSession> findByTokenId(String tokenId);

    // 살아있는 세션 목록 (GET /sessions)
    List<RefreshSession> findByUserIdAndRevokedAtIsNullAndExpiresAtAfterOrderByCreatedAtDesc(Long userId, LocalDateTime now);

    /**
     * 로테이션용 compare-and-revoke
     *
     * - "revoked_at IS NULL AND expires_at > now" 조건부 UPDATE 한 문장으로 폐기한다.
     * - 같은 refresh로 동시에 두 요청이 들어와도 1을 받는 쪽은 하나뿐이다.
     *   0을 받은 쪽은 진 요청이므로 새 토큰을 발급하면 안 된다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshSession s
               set s.revokedAt = :now, s.revokeReason = :reason, s.lastUsedAt = :now
             where s.tokenId = :tokenId
               and s.revokedAt is null
               and s.expiresAt > :now
            """)
    int revokeIfActive(@Param("tokenId") String tokenId,
                       @Param("now") LocalDateTime now,
                       @Param("reason") SessionRevokeReason reason);

    // 로그아웃: 본인 세션일 때만 폐기 (이미 폐기됐으면 0, 멱등)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshSession s
               set s.revokedAt = :now, s.revokeReason = :reason
             where s.tokenId = :tokenId
               and s.userId = :userId
               and s.revokedAt is null
            """)
    int revokeIfOwned(@Param("tokenId") String tokenId,
                      @Param("userId") Long userId,
                      @Param("now") LocalDateTime now,
                      @Param("reason") SessionRevokeReason reason);

    // 전체 로그아웃 / 비밀번호 재설정 / 재사용 감지
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshSession s
               set s.revokedAt = :now, s.revokeReason = :reason
             where s.userId = :userId
               and s.revokedAt is null
            """)
    int revokeAllByUserId(@Param("userId") Long userId,
                          @Param("now") LocalDateTime now,
                          @Param("reason") SessionRevokeReason reason);
}
