package com.coinboard.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 서비스/도메인 정책 위반을 ErrorCode로 표현하는 런타임 예외
 *
 * - throw new ApiException(ErrorCode.REFRESH_EXPIRED);
 * - GlobalExceptionHandler / SecurityErrorWriter가 ApiError로 직렬화한다.
 * - status는 항상 ErrorCode에서만 결정된다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;
    private final String code;       // ex: "ACCOUNT_LOCKED"
    private final Integer retryAfterSeconds;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null, null, null);
    }

    public ApiException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, null, null, null, cause);
    }

    public ApiException(ErrorCode errorCode, Integer retryAfterSeconds) {
        this(errorCode, null, retryAfterSeconds, null, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Integer retryAfterSeconds, Object details, Throwable cause) {
        // super(...)가 첫 줄이어야 해서 null 검사는 resolveMessage 안에서 먼저 한다.
        super(resolveMessage(errorCode, messageOverride), cause);

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (errorCode == null) {
            throw new IllegalArgumentException("ErrorCode must not be null");
        }
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return errorCode.defaultMessage();
    }
}
