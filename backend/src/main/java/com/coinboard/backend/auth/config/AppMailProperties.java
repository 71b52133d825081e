package com.coinboard.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * app:
 *   mail:
 *     from: ${APP_MAIL_FROM}
 *     frontend-base-url: ${APP_FRONTEND_BASE_URL:http://localhost:3000}
 *
 * frontendBaseUrl: 인증/재설정 링크의 앞부분 (ex: https://coinboard.app)
 */
@Validated
@ConfigurationProperties(prefix = "app.mail")
public record AppMailProperties(
        @NotBlank @Email String from,
        @NotBlank @Pattern(regexp = "^https?://.+", message = "frontendBaseUrl must be an http(s) URL") String frontendBaseUrl) {
}
