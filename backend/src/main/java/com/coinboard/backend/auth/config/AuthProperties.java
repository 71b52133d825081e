package com.coinboard.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml의 app.auth.* 값을 타입 안정성 있게 바인딩한다. (@Validated 위반 시 부팅 실패)

  app:
    auth:
      jwt:
        issuer: coinboard-api
        access-ttl-seconds: 900
        secret: ${APP_AUTH_JWT_SECRET}

      refresh:
        secret: ${APP_AUTH_REFRESH_SECRET}   # access secret과 반드시 달라야 함 (JwtService에서 검사)
        ttl-seconds: 604800
        reuse-policy: REVOKE_ALL

      password:
        bcrypt-strength: 12

      lockout:
        max-attempts: 5
        lock-minutes: 15

      email-token:
        verification-ttl-hours: 24
        reset-ttl-minutes: 60
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh,
                             @Valid @NotNull Password password,
                             @Valid @NotNull Lockout lockout,
                             @Valid @NotNull EmailToken emailToken) {

    /**
     * Access Token(JWT) 관련 설정
     * - issuer: 토큰 발급자 식별자 (access/refresh 공통)
     * - accessTtlSeconds: Access Token 수명
     * - secret: HS256 서명 키
     */
    public record Jwt(
            @NotBlank String issuer,
            @Min(1) long accessTtlSeconds,
            @NotBlank @Size(min = 32) String secret
    ) {}

    /**
     * Refresh Token(JWT) + 세션 관련 설정
     * - secret: refresh 전용 HS256 서명 키
     * - ttlSeconds: refresh 토큰/세션 수명
     * - reusePolicy: 이미 로테이션된 refresh가 다시 제출됐을 때의 처리
     */
    public record Refresh(
            @NotBlank @Size(min = 32) String secret,
            @Min(1) long ttlSeconds,
            @NotNull ReusePolicy reusePolicy
    ) {}

    // BCrypt cost factor (2^strength rounds)
    public record Password(
            @Min(4) @Max(31) int bcryptStrength
    ) {}

    /**
     * 로그인 실패 잠금 정책
     * - maxAttempts번 연속 실패하면 lockMinutes 동안 잠근다. (영구 잠금 없음)
     */
    public record Lockout(
            @Min(1) int maxAttempts,
            @Min(1) long lockMinutes
    ) {}

    // 메일 링크로 전달되는 일회용 토큰 수명
    public record EmailToken(
            @Min(1) long verificationTtlHours,
            @Min(1) long resetTtlMinutes
    ) {}

    /**
     * ROTATED refresh 재제출 시 정책
     * - REVOKE_ALL: 탈취 신호로 보고 해당 유저의 모든 세션을 폐기한다.
     * - REJECT: 요청만 거절한다.
     */
    public enum ReusePolicy {
        REVOKE_ALL, REJECT
    }
}
