package com.coinboard.backend.health;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.coinboard.backend.infra.AbstractIntegrationTest;

/**
 * Actuator Health
 * - health/liveness/readiness는 인증 없이 열려 있어야 한다. (헬스 체크가 막히면 재시작/트래픽 차단)
 * - actuator의 나머지 엔드포인트는 노출하지 않는다.
 * - vendor media type(application/vnd.spring-boot.actuator.v3+json)까지 허용해서 비교한다.
 */
@DisplayName("[Actuator] health 체크")
class ActuatorHealthTest extends AbstractIntegrationTest {

    @Autowired MockMvc mvc;

    private static final MediaType ANY_JSON_PLUS = MediaType.parseMediaType("application/*+json");

    @Test
    @DisplayName("GET /actuator/health -> 200 + JSON + UP (인증 없음)")
    void health_up() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(ANY_JSON_PLUS))
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /actuator/health/liveness, readiness -> 200 + UP")
    void health_endpoints_up() throws Exception {
        mvc.perform(get("/actuator/health/liveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));

        mvc.perform(get("/actuator/health/readiness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /actuator/env -> 노출 안 됨 (인증 없으면 401 AUTH_REQUIRED)")
    void other_actuator_endpoints_are_closed() throws Exception {
        mvc.perform(get("/actuator/env"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_REQUIRED"));
    }
}
