package com.coinboard.backend.auth.guest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.coinboard.backend.auth.AbstractAuthIntegrationTest;
import com.coinboard.backend.auth.support.AuthFlowSupport;
import com.coinboard.backend.auth.support.AuthFlowSupport.Tokens;
import com.coinboard.backend.auth.support.AuthHttpSupport;
import com.coinboard.backend.global.ErrorCode;

@DisplayName("[Auth][Guest] 로그인 상태로 게스트 전용 라우트 접근 차단")
class AuthGuestOnlyTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    private Tokens tokens;

    @BeforeEach
    void setUp() throws Exception {
        createDefaultUser();
        tokens = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
    }

    @Test
    @DisplayName("register/login/forgot/reset: 유효한 Bearer → 403 ALREADY_AUTHENTICATED")
    void guest_post_routes_reject_authenticated() throws Exception {
        String[] endpoints = {
                AuthHttpSupport.REGISTER_ENDPOINT,
                AuthHttpSupport.LOGIN_ENDPOINT,
                AuthHttpSupport.FORGOT_PASSWORD_ENDPOINT,
                AuthHttpSupport.RESET_PASSWORD_ENDPOINT
        };
        for (String endpoint : endpoints) {
            AuthHttpSupport.expectErrorWithCode(
                    mvc.perform(post(endpoint)
                            .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(tokens.accessToken()))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"" + EMAIL + "\",\"password\":\"" + PASSWORD + "\"}")),
                    ErrorCode.ALREADY_AUTHENTICATED);
        }

        // 거부된 login은 세션을 만들지 않는다
        assertThat(sessionRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("verify-email: 유효한 Bearer → 403 ALREADY_AUTHENTICATED")
    void verify_email_rejects_authenticated() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                mvc.perform(get(AuthHttpSupport.VERIFY_EMAIL_ENDPOINT)
                        .param("token", "any")
                        .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(tokens.accessToken()))),
                ErrorCode.ALREADY_AUTHENTICATED);
    }

    @Test
    @DisplayName("refresh는 게스트 전용이 아니다: Bearer가 같이 와도 200")
    void refresh_allows_authenticated() throws Exception {
        mvc.perform(post(AuthHttpSupport.REFRESH_ENDPOINT)
                        .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(tokens.accessToken()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + tokens.refreshToken() + "\"}"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Authorization 없이 호출하면 게스트 라우트는 그대로 동작")
    void guest_routes_work_without_token() throws Exception {
        AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.performForgotPassword(mvc, EMAIL).andExpect(status().isOk());
    }
}
