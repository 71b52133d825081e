package com.coinboard.backend.auth.support;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * 요청 DTO(@Pattern)와 서비스 방어 검증이 같이 쓰는 입력 규칙
 */
public final class AuthPatterns {

    private AuthPatterns() {}

    // 8~64자, 대문자+소문자+숫자+특수문자 각 1개 이상, 공백 금지
    // - 특수문자는 "영문/숫자/공백이 아닌 문자"로 정의
    public static final String PASSWORD_REGEX =
            "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[^A-Za-z0-9\\s])\\S{8,64}$";

    // BCrypt는 앞 72바이트만 본다. 그 뒤가 다른 두 비밀번호가 같은 해시가 되지 않도록 상한을 둔다.
    public static final int PASSWORD_MAX_BYTES = 72;

    private static final Pattern PASSWORD_PATTERN = Pattern.compile(PASSWORD_REGEX);

    // 3~30자, 영문/숫자/_ 만
    public static final String USERNAME_REGEX =
            "^[A-Za-z0-9_]{3,30}$";

    public static final int NAME_MAX = 50;

    /** 가입/재설정 비밀번호 정책: 문자 규칙 + UTF-8 72바이트 이하 */
    public static boolean isAcceptablePassword(String raw) {
        return raw != null
                && PASSWORD_PATTERN.matcher(raw).matches()
                && fitsBcryptLimit(raw);
    }

    public static boolean fitsBcryptLimit(String raw) {
        return raw.getBytes(StandardCharsets.UTF_8).length <= PASSWORD_MAX_BYTES;
    }
}
