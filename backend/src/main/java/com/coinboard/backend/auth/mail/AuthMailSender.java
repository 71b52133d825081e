package com.coinboard.backend.auth.mail;

import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import com.coinboard.backend.auth.config.AppMailProperties;
import com.coinboard.backend.auth.config.AuthProperties;

import lombok.RequiredArgsConstructor;

/**
 * 인증/재설정 메일 발송 어댑터 (외부 I/O)
 * - 서비스는 이벤트만 발행하고, 실제 SMTP 호출은 커밋 이후 리스너가 이 클래스를 통해 한다.
 * - 링크: {frontendBaseUrl}/verify-email?token=..., {frontendBaseUrl}/reset-password?token=...
 */
@Component
@RequiredArgsConstructor
public class AuthMailSender {

    static final String VERIFY_SUBJECT = "[Coinboard] Verify your email";
    static final String RESET_SUBJECT = "[Coinboard] Reset your password";

    private final JavaMailSender mailSender;
    private final AppMailProperties mailProps;
    private final AuthProperties authProps;

    public void sendVerification(String toEmail, String username, String rawToken) {
        String link = buildLink("/verify-email", rawToken);
        String body = "Hi " + username + ",\n\n"
                + "Confirm your email address by opening the link below.\n"
                + link + "\n\n"
                + "This link expires in " + authProps.emailToken().verificationTtlHours() + " hours.";
        send(toEmail, VERIFY_SUBJECT, body);
    }

    public void sendPasswordReset(String toEmail, String rawToken) {
        String link = buildLink("/reset-password", rawToken);
        String body = "A password reset was requested for your account.\n\n"
                + link + "\n\n"
                + "This link expires in " + authProps.emailToken().resetTtlMinutes() + " minutes.\n"
                + "If you did not request it, you can ignore this mail.";
        send(toEmail, RESET_SUBJECT, body);
    }

    private void send(String toEmail, String subject, String body) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setTo(toEmail);
        msg.setFrom(mailProps.from());
        msg.setSubject(subject);
        msg.setText(body);
        mailSender.send(msg);
    }

    private String buildLink(String path, String rawToken) {
        return UriComponentsBuilder.fromHttpUrl(mailProps.frontendBaseUrl())
                .path(path)
                .queryParam("token", rawToken)
                .build()
                .toUriString();
    }
}
