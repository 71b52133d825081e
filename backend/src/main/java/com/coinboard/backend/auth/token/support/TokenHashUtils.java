package com.coinboard.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 일회용 토큰 해시 유틸
 *
 * - 이메일 인증/재설정 토큰 원문이 DB에 있으면 DB 유출만으로 계정 탈취가 가능하다.
 * - DB에는 sha256 hex(64)만 저장하고, 조회는 incoming raw -> sha256Hex -> 컬럼 동등 비교로 한다.
 * - 토큰 자체가 고엔트로피 난수라 salt/BCrypt는 필요 없다.
 */
public final class TokenHashUtils {
    private TokenHashUtils() {}

    private static final HexFormat HEX = HexFormat.of(); // lowercase

    public static String sha256Hex(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }
        return HEX.formatHex(sha256(raw.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256이 없으면 JVM 자체가 비정상
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
