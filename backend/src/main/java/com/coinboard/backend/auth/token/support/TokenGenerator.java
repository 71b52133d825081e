package com.coinboard.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * 예측 불가능한 토큰 문자열 생성기
 *
 * - SecureRandom + Base64 URL-safe(padding 제거): 쿼리스트링/JSON에 그대로 실어도 안전
 * - refresh JWT의 jti(tokenId)와 메일 링크용 일회용 토큰을 만든다.
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int TOKEN_ID_BYTES = 32;   // base64url 43자
    private static final int ONE_TIME_BYTES = 48;   // base64url 64자

    private final SecureRandom secureRandom;

    /** refresh 세션 식별자(jti) */
    public String generateTokenId() {
        return randomUrlSafe(TOKEN_ID_BYTES);
    }

    /** 이메일 인증 / 비밀번호 재설정 링크 토큰 (원문은 메일로만 나간다) */
    public String generateOneTimeToken() {
        return randomUrlSafe(ONE_TIME_BYTES);
    }

    private String randomUrlSafe(int size) {
        byte[] bytes = new byte[size];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
