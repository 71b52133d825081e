package com.coinboard.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 인증 모듈 공통 빈
 *
 * @EnableConfigurationProperties
 *  - { AuthProperties, AppMailProperties }를 바인딩 + 검증한다.
 */
@Configuration
@EnableConfigurationProperties({
        AuthProperties.class,
        AppMailProperties.class
})
public class AuthModuleConfig {

    /**
     * 서버 표준 시각은 UTC.
     * - 테스트에서는 AbstractIntegrationTest가 MovableClock으로 대체한다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    // cost factor는 설정값으로 (테스트는 4로 낮춘다)
    @Bean
    public PasswordEncoder passwordEncoder(AuthProperties props) {
        return new BCryptPasswordEncoder(props.password().bcryptStrength());
    }
}
