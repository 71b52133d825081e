package com.coinboard.backend.auth.identity.dto;

import com.coinboard.backend.auth.token.dto.TokenPair;

// register(201) / login(200) 공통 응답
public record AuthResponse(UserResponse user, TokenPair tokens) {}
