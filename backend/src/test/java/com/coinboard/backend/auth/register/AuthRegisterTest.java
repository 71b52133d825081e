package com.coinboard.backend.auth.register;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.coinboard.backend.auth.AbstractAuthIntegrationTest;
import com.coinboard.backend.auth.domain.User;
import com.coinboard.backend.auth.domain.UserRole;
import com.coinboard.backend.auth.support.AuthFlowSupport;
import com.coinboard.backend.auth.support.AuthHttpSupport;
import com.coinboard.backend.auth.support.MailCaptureSupport;
import com.coinboard.backend.auth.token.support.TokenHashUtils;
import com.coinboard.backend.global.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;

@DisplayName("[Auth][Register] 회원가입 통합 테스트")
class AuthRegisterTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    @DisplayName("register: 정상 → 201 {user, tokens} + 미인증 USER 저장 + 세션 1개")
    void register_success() throws Exception {
        MvcResult res = AuthHttpSupport.performRegister(mvc, USERNAME, EMAIL, PASSWORD)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.username").value(USERNAME))
                .andExpect(jsonPath("$.user.email").value(EMAIL))
                .andExpect(jsonPath("$.user.firstName").value("Alice"))
                .andExpect(jsonPath("$.user.lastName").value("Kim"))
                .andExpect(jsonPath("$.user.verified").value(false))
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist())
                .andExpect(jsonPath("$.tokens.accessToken").isNotEmpty())
                .andExpect(jsonPath("$.tokens.refreshToken").isNotEmpty())
                .andReturn();

        Long userId = AuthHttpSupport.readJson(res).get("user").get("id").asLong();
        User saved = reload(userId);

        assertThat(saved.getRole()).isEqualTo(UserRole.USER);
        assertThat(saved.isVerified()).isFalse();
        assertThat(saved.getPasswordHash()).isNotEqualTo(PASSWORD).startsWith("$2");
        assertThat(passwordEncoder.matches(PASSWORD, saved.getPasswordHash())).isTrue();

        var sessions = sessionRepository.findAll();
        assertThat(sessions).hasSize(1);
        assertThat(sessions.get(0).getUserId()).isEqualTo(userId);
        assertThat(sessions.get(0).getUserAgent()).isEqualTo("JUnit");
    }

    @Test
    @DisplayName("register: 인증 메일 발송 + DB에는 토큰 원문 대신 sha256 해시만 저장")
    void register_sends_verification_mail_with_hashed_token() throws Exception {
        AuthFlowSupport.registerOk(mvc, USERNAME, EMAIL, PASSWORD);

        SimpleMailMessage mail = MailCaptureSupport.lastMessageTo(mailSender, EMAIL);
        assertThat(mail.getText()).contains("http://localhost:3000/verify-email?token=");
        assertThat(mail.getFrom()).isEqualTo("no-reply@coinboard.test");

        String raw = MailCaptureSupport.extractToken(mail);
        User saved = userRepository.findByEmail(EMAIL).orElseThrow();

        assertThat(saved.getEmailVerificationTokenHash())
                .isNotEqualTo(raw)
                .isEqualTo(TokenHashUtils.sha256Hex(raw));
        assertThat(saved.getEmailVerificationExpiresAt())
                .isEqualTo(saved.getCreatedAt().plusHours(24));
    }

    @Test
    @DisplayName("register: 이메일은 trim + 소문자로 정규화되어 저장")
    void register_normalizes_email() throws Exception {
        AuthFlowSupport.registerOk(mvc, USERNAME, "  Alice@CoinBoard.TEST ", PASSWORD);

        assertThat(userRepository.findByEmail(EMAIL)).isPresent();
    }

    @Test
    @DisplayName("register: 같은 이메일 재가입(대소문자만 다름) → 409 EMAIL_ALREADY_EXISTS")
    void register_duplicate_email() throws Exception {
        AuthFlowSupport.registerOk(mvc, USERNAME, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "alice2", EMAIL.toUpperCase(), PASSWORD),
                ErrorCode.EMAIL_ALREADY_EXISTS);

        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("register: 같은 username → 409 USERNAME_ALREADY_EXISTS")
    void register_duplicate_username() throws Exception {
        AuthFlowSupport.registerOk(mvc, USERNAME, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, USERNAME, "other@coinboard.test", PASSWORD),
                ErrorCode.USERNAME_ALREADY_EXISTS);
    }

    @Test
    @DisplayName("register: 약한 비밀번호(특수문자 없음/짧음/공백 포함) → 400 WEAK_PASSWORD, 저장/메일 없음")
    void register_weak_password() throws Exception {
        for (String weak : new String[] {"Abc12345", "Ab1!", "Abc 123!@", "abc123!@", "ABC123!@"}) {
            AuthHttpSupport.expectErrorWithCode(
                    AuthHttpSupport.performRegister(mvc, USERNAME, EMAIL, weak),
                    ErrorCode.WEAK_PASSWORD);
        }

        assertThat(userRepository.count()).isZero();
        verify(mailSender, never()).send(any(SimpleMailMessage.class));
    }

    @Test
    @DisplayName("register: 이메일 형식 오류 / username 규칙 위반 / 필수값 누락 → 400 VALIDATION_ERROR")
    void register_validation_error() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, USERNAME, "not-an-email", PASSWORD),
                ErrorCode.VALIDATION_ERROR);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "a!", EMAIL, PASSWORD),
                ErrorCode.VALIDATION_ERROR);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, USERNAME, EMAIL, "  "),
                ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("register: 발급된 access 토큰으로 바로 /me 조회 가능")
    void register_tokens_are_usable() throws Exception {
        AuthFlowSupport.Tokens tokens = AuthFlowSupport.registerOk(mvc, USERNAME, EMAIL, PASSWORD);

        MvcResult me = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(tokens.accessToken()))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode json = AuthHttpSupport.readJson(me);
        assertThat(json.get("email").asText()).isEqualTo(EMAIL);
    }
}
