package com.coinboard.backend.auth.identity.login.dto;

import com.coinboard.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * 로그인 요청
 * - 형식 검증(@Email/@NotBlank)만. 비밀번호 정책은 로그인에서 검사하지 않는다.
 */
public record LoginRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email
        @NotBlank
        String email,

        @NotBlank
        String password
) {}
