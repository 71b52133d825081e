package com.coinboard.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.coinboard.backend.auth.config.AuthProperties;
import com.coinboard.backend.auth.domain.UserRole;
import com.coinboard.backend.auth.token.support.TokenGenerator;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access / Refresh 토큰(JWT) 발급/검증 서비스
 *
 * - HTTP(상태코드/응답)는 모른다. "유효/만료/무효"만 판단한다.
 * - access와 refresh는 서로 다른 HMAC 키로 서명한다.
 *   한쪽 토큰을 다른 쪽 자리에 넣으면 서명 검증에서 바로 떨어진다.
 *
 * Access Token:
 * - iss/sub(userId)/role/typ=access/iat/exp
 * - 매 요청 Authorization: Bearer <accessToken>, DB 조회 없이 서명만으로 검증
 *
 * Refresh Token:
 * - iss/sub(userId)/jti(tokenId)/typ=refresh/iat/exp
 * - 서명이 맞아도 refresh_sessions의 jti row가 살아 있어야 유효하다. (RefreshTokenService)
 *
 * 실패는 InvalidJwtException(만료면 ExpiredJwtTokenException)으로 통일한다.
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String ROLE_CLAIM = "role";
    private static final String TYPE_CLAIM = "typ";
    private static final String TYPE_ACCESS = "access";
    private static final String TYPE_REFRESH = "refresh";

    private final AuthProperties.Jwt jwtProps;
    private final AuthProperties.Refresh refreshProps;
    private final Clock clock;
    private final TokenGenerator tokenGenerator;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final JwtParser accessParser;
    private final JwtParser refreshParser;

    public JwtService(AuthProperties props, Clock clock, TokenGenerator tokenGenerator) {
        this.jwtProps = props.jwt();
        this.refreshProps = props.refresh();
        this.clock = clock;
        this.tokenGenerator = tokenGenerator;

        byte[] accessSecret = secretBytes(jwtProps.secret(), "access");
        byte[] refreshSecret = secretBytes(refreshProps.secret(), "refresh");
        if (Arrays.equals(accessSecret, refreshSecret)) {
            throw new IllegalStateException("Access and refresh JWT secrets must differ");
        }

        this.accessKey = Keys.hmacShaKeyFor(accessSecret);
        this.refreshKey = Keys.hmacShaKeyFor(refreshSecret);

        // issuer(iss) 고정(requireIssuer)로 타 서비스 토큰을 차단한다.
        this.accessParser = buildParser(jwtProps.issuer(), accessKey, clock);
        this.refreshParser = buildParser(jwtProps.issuer(), refreshKey, clock);
    }


    /** userId/role 기반 Access JWT 발급 */
    public String issueAccessToken(Long userId, UserRole role) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())
                .setSubject(String.valueOf(userId))
                .claim(ROLE_CLAIM, role.name())
                .claim(TYPE_CLAIM, TYPE_ACCESS)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(accessKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Refresh JWT 발급
     * - jti(tokenId)는 새 난수. 호출자는 같은 tokenId로 refresh_sessions row를 만들어야 한다.
     */
    public IssuedRefresh issueRefreshToken(Long userId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        String tokenId = tokenGenerator.generateTokenId();

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(refreshProps.ttlSeconds());

        String token = Jwts.builder()
                .setIssuer(jwtProps.issuer())
                .setSubject(String.valueOf(userId))
                .setId(tokenId)
                .claim(TYPE_CLAIM, TYPE_REFRESH)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(refreshKey, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedRefresh(token, tokenId, now, exp);
    }

    public AuthPrincipal verifyAccessToken(String token) {
        Claims claims = parse(accessParser, token, TYPE_ACCESS);
        try {
            return new AuthPrincipal(
                    parseUserId(claims.getSubject()),
                    parseRole(claims.get(ROLE_CLAIM, String.class)));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid access JWT", e);
        }
    }

    public RefreshClaims verifyRefreshToken(String token) {
        Claims claims = parse(refreshParser, token, TYPE_REFRESH);
        try {
            Long userId = parseUserId(claims.getSubject());
            String tokenId = claims.getId();
            if (tokenId == null || tokenId.isBlank()) {
                throw new JwtException("jti is missing");
            }
            return new RefreshClaims(userId, tokenId);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid refresh JWT", e);
        }
    }


    // 서명/만료/issuer/포맷/typ 검증 (하나라도 실패하면 예외)
    private static Claims parse(JwtParser parser, String token, String expectedType) {
        try {
            if (token == null || token.isBlank()) {
                throw new JwtException("token is null or blank");
            }
            Claims claims = parser.parseClaimsJws(token).getBody();
            if (!expectedType.equals(claims.get(TYPE_CLAIM, String.class))) {
                throw new JwtException("unexpected token type");
            }
            return claims;
        } catch (ExpiredJwtException e) {
            throw new ExpiredJwtTokenException("Expired JWT", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }

    private static byte[] secretBytes(String secret, String name) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT " + name + " secret must not be blank");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "JWT " + name + " secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        return bytes;
    }

    private static JwtParser buildParser(String issuer, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    private static Long parseUserId(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject (userId) is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    private static UserRole parseRole(String roleRaw) {
        if (roleRaw == null || roleRaw.isBlank()) {
            throw new JwtException("role claim missing");
        }
        try {
            return UserRole.valueOf(roleRaw);
        } catch (IllegalArgumentException e) {
            throw new JwtException("role claim invalid: " + roleRaw, e);
        }
    }


    public record IssuedRefresh(String token, String tokenId, Instant issuedAt, Instant expiresAt) {}

    public record RefreshClaims(Long userId, String tokenId) {}

    /**
     * HTTP 레벨과 분리된 "JWT 검증 실패" 예외
     * - Filter / RefreshTokenService에서 잡아서 ErrorCode로 바꾼다.
     */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    // 서명은 맞지만 exp가 지난 경우
    public static class ExpiredJwtTokenException extends InvalidJwtException {
        public ExpiredJwtTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
