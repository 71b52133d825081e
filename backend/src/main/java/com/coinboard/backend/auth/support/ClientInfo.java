package com.coinboard.backend.auth.support;

import org.springframework.http.HttpHeaders;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 세션 발급 시점의 클라이언트 정보 (세션 목록 화면 표시용)
 * - 인증/인가 판단에는 쓰지 않는다.
 */
public record ClientInfo(String userAgent, String ipAddress) {

    public static final ClientInfo UNKNOWN = new ClientInfo(null, null);

    // 프록시 뒤라면 X-Forwarded-For의 첫 번째 값을 쓴다.
    public static ClientInfo from(HttpServletRequest request) {
        if (request == null) return UNKNOWN;

        String forwarded = request.getHeader("X-Forwarded-For");
        String ip = (forwarded != null && !forwarded.isBlank())
                ? forwarded.split(",", 2)[0].trim()
                : request.getRemoteAddr();

        return new ClientInfo(request.getHeader(HttpHeaders.USER_AGENT), ip);
    }
}
