package com.coinboard.backend.auth.support;

import java.util.Locale;

public final class EmailUtils {

    private EmailUtils() {}

    // 이메일은 대소문자 구분 없이 유일하다: trim + 소문자로 저장/조회
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 로그용 마스킹: alice@x.com -> a***@x.com
     * - 로그에 전체 이메일을 남기지 않는다.
     */
    public static String mask(String email) {
        if (email == null) return null;
        int at = email.indexOf('@');
        if (at <= 0) return "***";
        return email.charAt(0) + "***" + email.substring(at);
    }
}
