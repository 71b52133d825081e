package com.coinboard.backend.auth.support;

import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;

/**
 * 비밀번호 해시/검증 어댑터 (BCrypt)
 *
 * - hash(): salt가 해시 문자열 안에 포함되므로 같은 비밀번호도 매번 다른 결과가 나온다.
 *   cost factor는 app.auth.password.bcrypt-strength (AuthModuleConfig의 PasswordEncoder 빈)
 * - 72바이트(UTF-8)를 넘는 원문: hash()는 거절, verify()는 false. (BCrypt가 뒤를 잘라버리므로)
 * - verify(): 불일치는 false. 저장된 해시가 BCrypt 형식이 아니면 CORRUPT_HASH.
 *   (BCryptPasswordEncoder.matches는 깨진 해시를 경고 로그 + false로 넘기기 때문에 여기서 먼저 걸러낸다)
 * - 인코더 내부 실패(엔트로피/리소스)는 HASHING_FAILED로 감싼다.
 */
@Component
public class PasswordHasher {

    private static final Pattern BCRYPT_PATTERN =
            Pattern.compile("\\A\\$2(a|y|b)?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    // 존재하지 않는 이메일로 로그인할 때도 같은 비용을 쓰기 위한 고정 해시
    private final String dummyHash;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("timing-equalizer-" + System.nanoTime());
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("plaintext must not be empty");
        }
        if (!AuthPatterns.fitsBcryptLimit(plaintext)) {
            throw new IllegalArgumentException(
                    "plaintext must be at most " + AuthPatterns.PASSWORD_MAX_BYTES + " bytes (UTF-8)");
        }
        try {
            return passwordEncoder.encode(plaintext);
        } catch (RuntimeException e) {
            throw new ApiException(ErrorCode.HASHING_FAILED, e);
        }
    }

    public boolean verify(String plaintext, String storedHash) {
        if (storedHash == null || !BCRYPT_PATTERN.matcher(storedHash).matches()) {
            throw new ApiException(ErrorCode.CORRUPT_HASH);
        }
        if (plaintext == null || !AuthPatterns.fitsBcryptLimit(plaintext)) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, storedHash);
        } catch (RuntimeException e) {
            throw new ApiException(ErrorCode.HASHING_FAILED, e);
        }
    }

    /**
     * 결과는 버리고 BCrypt 비교 비용만 소모한다.
     * - "이메일 없음"과 "비밀번호 틀림"의 응답 시간 차이로 계정 유무가 드러나지 않게 한다.
     */
    public void dummyVerify(String plaintext) {
        passwordEncoder.matches(plaintext == null ? "" : plaintext, dummyHash);
    }
}
