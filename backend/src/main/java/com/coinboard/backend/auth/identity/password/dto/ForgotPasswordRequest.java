package com.coinboard.backend.auth.identity.password.dto;

import com.coinboard.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record ForgotPasswordRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email
        String email
) {}
