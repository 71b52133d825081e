package com.coinboard.backend.auth.mail.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.coinboard.backend.auth.mail.AuthMailSender;
import com.coinboard.backend.auth.support.EmailUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuthMailEventListener {

    private final AuthMailSender mailSender;

    // 커밋이 끝난 뒤에만 실행된다. (롤백되면 메일도 나가지 않음)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void on(VerificationMailRequestedEvent event) {
        try {
            mailSender.sendVerification(event.email(), event.username(), event.rawToken());
        } catch (Exception e) {
            // 가입은 이미 커밋됨. 메일 실패로 가입을 되돌리지 않는다.
            log.error("인증 메일 발송 실패. email={}", EmailUtils.mask(event.email()), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void on(PasswordResetMailRequestedEvent event) {
        try {
            mailSender.sendPasswordReset(event.email(), event.rawToken());
        } catch (Exception e) {
            log.error("비밀번호 재설정 메일 발송 실패. email={}", EmailUtils.mask(event.email()), e);
        }
    }
}
