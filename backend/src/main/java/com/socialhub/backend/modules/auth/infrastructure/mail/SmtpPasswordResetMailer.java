package com.socialhub.backend.modules.auth.infrastructure.mail;

import com.socialhub.backend.modules.auth.application.PasswordResetMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class SmtpPasswordResetMailer implements PasswordResetMailer {

    private static final Logger log = LoggerFactory.getLogger(SmtpPasswordResetMailer.class);

    static final String SUBJECT = "Password Reset Request";

    private final JavaMailSender mailSender;
    private final String resetUrl;
    private final String sender;

    public SmtpPasswordResetMailer(
            JavaMailSender mailSender,
            @Value("${app.mail.reset-url:http://localhost:3000/reset-password}") String resetUrl,
            @Value("${app.mail.from:no-reply@socialhub.app}") String sender
    ) {
        this.mailSender = mailSender;
        this.resetUrl = resetUrl;
        this.sender = sender;
    }

    @Async
    @Override
    public void sendPasswordResetEmail(String email, String resetToken) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(sender);
        message.setTo(email);
        message.setSubject(SUBJECT);
        message.setText(buildBody(resetToken));
        try {
            mailSender.send(message);
            log.info("Password reset mail sent to {}", email);
        } catch (MailException ex) {
            // delivery failures are not reported to the requester
            log.warn("Password reset mail to {} failed: {}", email, ex.getMessage());
        }
    }

    String buildBody(String resetToken) {
        String link = UriComponentsBuilder.fromUriString(resetUrl)
                .queryParam("token", resetToken)
                .toUriString();
        return """
                You requested a password reset.

                Open the link below to choose a new password. It expires in one hour.

                %s

                If you did not ask for this, you can ignore this message.
                """.formatted(link);
    }
}
