package com.coinboard.backend.security;

import java.io.IOException;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import com.coinboard.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 인증된 요청이 거부됐을 때 403 ALREADY_AUTHENTICATED
 * - 이 체인에서 인증된 사용자를 거부하는 규칙은 게스트 전용 라우트(anonymous())뿐이다.
 */
@RequiredArgsConstructor
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void handle(
            HttpServletRequest request,
            HttpServletResponse response,
            AccessDeniedException accessDeniedException) throws IOException {
        errorWriter.write(response, ErrorCode.ALREADY_AUTHENTICATED);
    }
}
