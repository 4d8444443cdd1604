package com.openparking.parking.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Best-effort email delivery.
 *
 * Runs on the notification executor, makes exactly one attempt and never throws:
 * the returned future completes with {@code false} when the mail was not sent.
 */
@Slf4j
@Service
public class NotificationService {

    @Autowired(required = false)
    private JavaMailSender mailSender;

    @Value("${parking.notification.enabled:true}")
    private boolean enabled;

    @Value("${parking.notification.from:no-reply@openparking.local}")
    private String from;

    @Async("notificationExecutor")
    public CompletableFuture<Boolean> send(String recipient, String subject, String body) {
        return CompletableFuture.completedFuture(deliver(recipient, subject, body));
    }

    boolean deliver(String recipient, String subject, String body) {
        if (!enabled || mailSender == null) {
            log.info("Mail delivery disabled, skipping '{}' to {}", subject, recipient);
            return false;
        }
        if (recipient == null || recipient.isBlank()) {
            log.warn("No recipient for '{}', skipping", subject);
            return false;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(from);
            message.setTo(recipient);
            message.setSubject(subject);
            message.setText(body);
            mailSender.send(message);
            log.info("Email '{}' sent to {}", subject, recipient);
            return true;
        } catch (Exception e) {
            log.warn("Failed to send email '{}' to {} (non-fatal)", subject, recipient, e);
            return false;
        }
    }
}
