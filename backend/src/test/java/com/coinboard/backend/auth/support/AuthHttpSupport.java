package com.coinboard.backend.auth.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import com.coinboard.backend.global.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * AuthHttpSupport = "HTTP 요청/응답" 저수준 유틸 (테스트 전용)
 *
 * 응답 예시 (login/register):
 * {"user":{"id":1,"username":"alice",...,"verified":false},
 *  "tokens":{"accessToken":"eyJ...","refreshToken":"eyJ..."}}
 */
public final class AuthHttpSupport {
    private AuthHttpSupport() {}

    private static final ObjectMapper om = new ObjectMapper();

    public static final String REGISTER_ENDPOINT = "/api/auth/register";
    public static final String LOGIN_ENDPOINT = "/api/auth/login";
    public static final String REFRESH_ENDPOINT = "/api/auth/refresh";
    public static final String LOGOUT_ENDPOINT = "/api/auth/logout";
    public static final String LOGOUT_ALL_ENDPOINT = "/api/auth/logout-all";
    public static final String VERIFY_EMAIL_ENDPOINT = "/api/auth/verify-email";
    public static final String FORGOT_PASSWORD_ENDPOINT = "/api/auth/forgot-password";
    public static final String RESET_PASSWORD_ENDPOINT = "/api/auth/reset-password";
    public static final String ME_ENDPOINT = "/api/auth/me";
    public static final String SESSIONS_ENDPOINT = "/api/auth/sessions";

    // POST: /api/auth/register
    public static ResultActions performRegister(MockMvc mvc, String username, String email, String password) throws Exception {
        return mvc.perform(post(REGISTER_ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.USER_AGENT, "JUnit")
                .content(om.writeValueAsString(new RegisterBody(username, email, password, "Alice", "Kim"))));
    }

    // POST: /api/auth/login
    public static ResultActions performLogin(MockMvc mvc, String email, String password) throws Exception {
        return mvc.perform(post(LOGIN_ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.USER_AGENT, "JUnit")
                .content(om.writeValueAsString(new LoginBody(email, password))));
    }

    // POST: /api/auth/refresh
    public static ResultActions performRefresh(MockMvc mvc, String refreshToken) throws Exception {
        return mvc.perform(post(REFRESH_ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(om.writeValueAsString(new RefreshBody(refreshToken))));
    }

    // POST: /api/auth/logout (refreshTokenOrNull == null 이면 바디 없이)
    public static ResultActions performLogout(MockMvc mvc, String accessToken, String refreshTokenOrNull) throws Exception {
        var req = post(LOGOUT_ENDPOINT);
        if (accessToken != null) req.header(HttpHeaders.AUTHORIZATION, bearer(accessToken));
        if (refreshTokenOrNull != null) {
            req.contentType(MediaType.APPLICATION_JSON)
               .content(om.writeValueAsString(new RefreshBody(refreshTokenOrNull)));
        }
        return mvc.perform(req);
    }

    // POST: /api/auth/logout-all
    public static ResultActions performLogoutAll(MockMvc mvc, String accessToken) throws Exception {
        var req = post(LOGOUT_ALL_ENDPOINT);
        if (accessToken != null) req.header(HttpHeaders.AUTHORIZATION, bearer(accessToken));
        return mvc.perform(req);
    }

    // GET: /api/auth/verify-email?token=
    public static ResultActions performVerifyEmail(MockMvc mvc, String tokenOrNull) throws Exception {
        var req = get(VERIFY_EMAIL_ENDPOINT);
        if (tokenOrNull != null) req.param("token", tokenOrNull);
        return mvc.perform(req);
    }

    // POST: /api/auth/forgot-password
    public static ResultActions performForgotPassword(MockMvc mvc, String email) throws Exception {
        return mvc.perform(post(FORGOT_PASSWORD_ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(om.writeValueAsString(new ForgotBody(email))));
    }

    // POST: /api/auth/reset-password
    public static ResultActions performResetPassword(MockMvc mvc, String token, String newPassword) throws Exception {
        return mvc.perform(post(RESET_PASSWORD_ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .content(om.writeValueAsString(new ResetBody(token, newPassword))));
    }

    // GET: /api/auth/me (authorizationHeaderOrNull은 "Bearer ..." 전체 값)
    public static ResultActions performMe(MockMvc mvc, String authorizationHeaderOrNull) throws Exception {
        var req = get(ME_ENDPOINT);
        if (authorizationHeaderOrNull != null) req.header(HttpHeaders.AUTHORIZATION, authorizationHeaderOrNull);
        return mvc.perform(req);
    }

    // GET: /api/auth/sessions
    public static ResultActions performSessions(MockMvc mvc, String accessToken) throws Exception {
        var req = get(SESSIONS_ENDPOINT);
        if (accessToken != null) req.header(HttpHeaders.AUTHORIZATION, bearer(accessToken));
        return mvc.perform(req);
    }

    public static String bearer(String accessToken) {
        return "Bearer " + accessToken;
    }

    /**
     * 에러 응답 공통 검증
     * - status == ErrorCode.status, body의 $.code == ErrorCode.name()
     */
    public static MvcResult expectErrorWithCode(ResultActions actions, ErrorCode code) throws Exception {
        MvcResult res = actions
                .andExpect(status().is(code.status().value()))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andReturn();

        JsonNode json = readJson(res);
        assertThat(json.get("code"))
                .as("error response must contain $.code")
                .isNotNull();
        assertThat(json.get("code").asText()).isEqualTo(code.name());
        return res;
    }

    public static JsonNode readJson(MvcResult res) throws Exception {
        return om.readTree(res.getResponse().getContentAsString());
    }


    private record RegisterBody(String username, String email, String password, String firstName, String lastName) {}
    private record LoginBody(String email, String password) {}
    private record RefreshBody(String refreshToken) {}
    private record ForgotBody(String email) {}
    private record ResetBody(String token, String newPassword) {}
}
