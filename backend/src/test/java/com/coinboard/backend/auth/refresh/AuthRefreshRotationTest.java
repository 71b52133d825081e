package com.coinboard.backend.auth.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.coinboard.backend.auth.AbstractAuthIntegrationTest;
import com.coinboard.backend.auth.support.AuthFlowSupport;
import com.coinboard.backend.auth.support.AuthFlowSupport.Tokens;
import com.coinboard.backend.auth.support.AuthHttpSupport;
import com.coinboard.backend.auth.token.domain.RefreshSession;
import com.coinboard.backend.auth.token.domain.SessionRevokeReason;
import com.coinboard.backend.global.ErrorCode;
import com.coinboard.backend.security.JwtService;

@DisplayName("[Auth][Refresh] 로테이션 통합 테스트")
class AuthRefreshRotationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JwtService jwtService;

    @BeforeEach
    void setUp() {
        createDefaultUser();
    }

    @Test
    @DisplayName("refresh: 정상 로테이션 → 새 쌍 발급 + 기존 세션 ROTATED + 새 세션 살아있음")
    void refresh_rotates() throws Exception {
        Tokens login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        Tokens rotated = AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        assertThat(rotated.refreshToken()).isNotEqualTo(login.refreshToken());

        String oldTokenId = jwtService.verifyRefreshToken(login.refreshToken()).tokenId();
        String newTokenId = jwtService.verifyRefreshToken(rotated.refreshToken()).tokenId();

        RefreshSession old = sessionRepository.findByTokenId(oldTokenId).orElseThrow();
        RefreshSession fresh = sessionRepository.findByTokenId(newTokenId).orElseThrow();

        assertThat(old.getRevokeReason()).isEqualTo(SessionRevokeReason.ROTATED);
        assertThat(old.getRevokedAt()).isNotNull();
        assertThat(old.getLastUsedAt()).isNotNull();
        assertThat(fresh.isRevoked()).isFalse();
        assertThat(fresh.getUserAgent()).isEqualTo(old.getUserAgent());
    }

    @Test
    @DisplayName("refresh: 새 access 토큰으로 /me 200")
    void refresh_new_access_token_works() throws Exception {
        Tokens login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        Tokens rotated = AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(rotated.accessToken()))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("refresh: R1 → R2 성공 후 R1 다시 제출 → 401 REFRESH_REUSED")
    void refresh_same_token_twice_fails() throws Exception {
        Tokens login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.REFRESH_REUSED);
    }

    @Test
    @DisplayName("refresh: 연속 로테이션 R1 → R2 → R3 모두 성공")
    void refresh_chain() throws Exception {
        Tokens r1 = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        Tokens r2 = AuthFlowSupport.refreshOk(mvc, r1.refreshToken());
        Tokens r3 = AuthFlowSupport.refreshOk(mvc, r2.refreshToken());

        assertThat(r3.refreshToken()).isNotEqualTo(r2.refreshToken());
        assertThat(sessionRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("refresh: refreshToken 누락/공백 → 400 VALIDATION_ERROR")
    void refresh_blank_token() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, " "),
                ErrorCode.VALIDATION_ERROR);
    }
}
