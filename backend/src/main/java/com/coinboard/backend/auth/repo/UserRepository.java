package com.coinboard.backend.auth.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.coinboard.backend.auth.domain.User;

import jakarta.persistence.LockModeType;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    Optional<User> findByEmail(String email);

    Optional<User> findByEmailVerificationTokenHash(String tokenHash);

    /**
     * 재설정 토큰 1회 소비 보장용 Row Lock 조회 (SELECT ... FOR UPDATE)
     * - 같은 토큰으로 동시에 두 번 재설정이 성공하는 것을 막는다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.passwordResetTokenHash = :tokenHash")
    Optional<User> findByPasswordResetTokenHashForUpdate(@Param("tokenHash") String tokenHash);


    /*
     * ===== 로그인 실패 카운터 =====
     *
     * 엔티티를 읽어서 +1 하고 저장하면(read-modify-write) 동시 실패 요청끼리 값을 덮어써서 횟수가 덜 세진다.
     * 그래서 DB의 단일 UPDATE 문으로만 증가/잠금/해제를 한다. (서버가 여러 대여도 동일)
     */

    // 실패 횟수 +1 (원자적)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update User u set u.loginAttempts = u.loginAttempts + 1 where u.id = :id")
    int incrementLoginAttempts(@Param("id") Long id);

    /**
     * 실패 횟수가 임계치 이상이면 잠금 (조건부 UPDATE)
     * - 이미 유효한 잠금이 걸려 있으면 lockedUntil을 연장하지 않는다.
     * @return 1이면 이번 요청으로 잠금이 걸린 것
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update User u set u.lockedUntil = :lockedUntil
             where u.id = :id
               and u.loginAttempts >= :maxAttempts
               and (u.lockedUntil is null or u.lockedUntil <= :now)
            """)
    int lockIfAttemptsReached(@Param("id") Long id,
                              @Param("maxAttempts") int maxAttempts,
                              @Param("lockedUntil") LocalDateTime lockedUntil,
                              @Param("now") LocalDateTime now);

    // 잠금 시간이 지난 계정은 카운터를 0부터 다시 센다.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update User u set u.loginAttempts = 0, u.lockedUntil = null
             where u.id = :id
               and u.lockedUntil is not null
               and u.lockedUntil <= :now
            """)
    int clearExpiredLock(@Param("id") Long id, @Param("now") LocalDateTime now);

    // 로그인 성공: 카운터/잠금 초기화 + 마지막 로그인 시각
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update User u set u.loginAttempts = 0, u.lockedUntil = null, u.lastLoginAt = :now where u.id = :id")
    int markLoginSucceeded(@Param("id") Long id, @Param("now") LocalDateTime now);
}
