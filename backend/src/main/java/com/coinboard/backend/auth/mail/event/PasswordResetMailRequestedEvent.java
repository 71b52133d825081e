package com.coinboard.backend.auth.mail.event;

public record PasswordResetMailRequestedEvent(String email, String rawToken) {}
