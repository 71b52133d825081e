package com.coinboard.backend.auth.identity.register.dto;

import com.coinboard.backend.auth.support.AuthPatterns;
import com.coinboard.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청
 * - 형식 검증만 한다. 비밀번호 강도는 RegisterService가 WEAK_PASSWORD로 판단한다.
 */
public record RegisterRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Pattern(regexp = AuthPatterns.USERNAME_REGEX, message = "username must be 3-30 letters, digits or underscores")
        String username,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email
        @Size(max = 255)
        String email,

        @NotBlank
        String password,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Size(max = AuthPatterns.NAME_MAX)
        String firstName,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Size(max = AuthPatterns.NAME_MAX)
        String lastName
) {}
