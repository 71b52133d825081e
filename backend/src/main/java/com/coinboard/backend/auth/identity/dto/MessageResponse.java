package com.coinboard.backend.auth.identity.dto;

public record MessageResponse(String message) {}
