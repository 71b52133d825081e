package com.coinboard.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 설정
 *
 * - Stateless: 서버 세션/쿠키 인증 없음 (CSRF, formLogin, httpBasic 끔)
 * - JwtAuthenticationFilter: Bearer access 토큰 -> SecurityContext
 * - 인증 없이 보호 리소스 접근: RestAuthEntryPoint (AUTH_REQUIRED)
 * - 로그인 상태로 게스트 전용 라우트 접근: RestAccessDeniedHandler (ALREADY_AUTHENTICATED)
 *
 * 게스트 전용(anonymous): 가입/로그인/이메일 인증/비밀번호 찾기·재설정
 * 공개(permitAll): refresh, health 체크
 * 나머지(/api/auth/me, /sessions, /logout, /logout-all 포함)는 인증 필요
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    RestAccessDeniedHandler restAccessDeniedHandler() {
        return new RestAccessDeniedHandler(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(jwtService, securityErrorWriter);
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(restAuthEntryPoint())
                        .accessDeniedHandler(restAccessDeniedHandler()))
                .addFilterBefore(jwtAuthenticationFilter(), UsernamePasswordAuthenticationFilter.class)
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers("/actuator/health/**").permitAll()

                        .requestMatchers(HttpMethod.POST,
                                "/api/auth/register",
                                "/api/auth/login",
                                "/api/auth/forgot-password",
                                "/api/auth/reset-password").anonymous()
                        .requestMatchers(HttpMethod.GET, "/api/auth/verify-email").anonymous()
                        .requestMatchers(HttpMethod.POST, "/api/auth/refresh").permitAll()

                        .anyRequest().authenticated()
                )
                .build();
    }
}
