package com.coinboard.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 바디
 *
 * - ControllerAdvice / Security EntryPoint / Filter 어디서 실패하든 같은 JSON 스키마로 내려간다.
 * - code: 클라이언트 분기용 고정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지
 * - retryAfterSeconds: 재시도 가능 시간 (ACCOUNT_LOCKED 등)
 * - details: 추가 정보(필요할 때만)
 *
 * null 필드는 직렬화하지 않는다. (@JsonInclude(NON_NULL))
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "REFRESH_REUSED"
        String message, // ex: "Refresh token is invalid."
        Integer retryAfterSeconds,
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null, null);
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.name(), messageOverride, null, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getRetryAfterSeconds(), e.getDetails());
    }
}
