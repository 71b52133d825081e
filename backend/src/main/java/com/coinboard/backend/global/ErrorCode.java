package com.coinboard.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - 계정 유무/토큰 상태를 추측할 수 있는 경로는 메시지를 뭉갠다.
 */
public enum ErrorCode {

    // Register
    EMAIL_ALREADY_EXISTS(HttpStatus.CONFLICT,
            "User with this email already exists"),
    USERNAME_ALREADY_EXISTS(HttpStatus.CONFLICT,
            "User with this username already exists"),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST,
            "Password must be 8-64 characters (at most 72 bytes) with upper, lower, digit and special character and no whitespace"),

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "Invalid credentials"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED,
            "Account is temporarily locked due to too many failed login attempts"),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "Authentication required"),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "Access token is invalid"),
    ACCESS_EXPIRED(HttpStatus.UNAUTHORIZED,
            "Access token has expired"),
    ALREADY_AUTHENTICATED(HttpStatus.FORBIDDEN,
            "Already authenticated"),

    // Refresh token
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "Refresh token is invalid"),
    REFRESH_EXPIRED(HttpStatus.UNAUTHORIZED,
            "Refresh token has expired"),
    REFRESH_REUSED(HttpStatus.UNAUTHORIZED,
            "Refresh token is invalid"), // 보안상 메시지 뭉개기
    REFRESH_REVOKED(HttpStatus.UNAUTHORIZED,
            "Refresh token is invalid"), // 보안상 메시지 뭉개기

    // Email verification / password reset
    VERIFICATION_TOKEN_INVALID(HttpStatus.BAD_REQUEST,
            "Verification token is invalid or has expired"),
    RESET_TOKEN_INVALID(HttpStatus.BAD_REQUEST,
            "Password reset token is invalid or has expired"),

    // User / Data consistency
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "User not found"),

    // Credential hashing (infra fault)
    HASHING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR,
            "Failed to process credentials"),
    CORRUPT_HASH(HttpStatus.INTERNAL_SERVER_ERROR,
            "Failed to process credentials"),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "Request validation failed"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "Internal server error");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
