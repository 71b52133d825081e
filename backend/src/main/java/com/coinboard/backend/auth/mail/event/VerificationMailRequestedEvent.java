package com.coinboard.backend.auth.mail.event;

/**
 * 가입 커밋 후 인증 메일 발송용 이벤트
 * - rawToken은 DB에 없으므로 이벤트로만 리스너에 전달된다.
 */
public record VerificationMailRequestedEvent(String email, String username, String rawToken) {}
