package com.itdesk.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entrega as notificações fora da thread da requisição. A fila é limitada:
 * quando enche, a notificação é descartada com aviso no log. Cada e-mail tem
 * até 3 tentativas com backoff exponencial.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final EmailService emailService;
    private final TaskExecutor executor;
    private final RetryTemplate retryTemplate;

    public NotificationDispatcher(EmailService emailService,
                                  @Qualifier("notificationExecutor") TaskExecutor executor,
                                  @Qualifier("mailRetryTemplate") RetryTemplate retryTemplate) {
        this.emailService = emailService;
        this.executor = executor;
        this.retryTemplate = retryTemplate;
    }

    public void dispatch(TicketNotificationEvent event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (TaskRejectedException e) {
            log.warn("Notification queue full, dropping {} for ticket {}",
                    event.type(), event.fields().get("ticketNumber"));
        }
    }

    void deliver(TicketNotificationEvent event) {
        try {
            Optional<EmailService.MailSettings> settings = emailService.activeSettings();
            if (settings.isEmpty()) {
                log.debug("Email notifications disabled, skipping {}", event.type());
                return;
            }
            List<EmailService.OutgoingMail> mails = emailService.compose(event, settings.get());
            for (EmailService.OutgoingMail mail : mails) {
                sendWithRetry(settings.get(), mail);
            }
        } catch (RuntimeException e) {
            log.error("Failed to prepare {} notification for ticket {}: {}",
                    event.type(), event.fields().get("ticketNumber"), e.getMessage());
        }
    }

    private void sendWithRetry(EmailService.MailSettings settings, EmailService.OutgoingMail mail) {
        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying email to {} (attempt {})", mail.to(), context.getRetryCount() + 1);
                }
                emailService.send(settings, mail);
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("Giving up on email '{}' to {}: {}", mail.subject(), mail.to(), e.getMessage());
        }
    }
}
