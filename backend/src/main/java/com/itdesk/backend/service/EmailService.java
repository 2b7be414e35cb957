package com.itdesk.backend.service;

import com.itdesk.backend.dto.SettingDTOs.SmtpOverride;
import com.itdesk.backend.exception.EmailDeliveryException;
import com.itdesk.backend.exception.MailConfigurationException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Monta e envia os e-mails de chamado. A configuração SMTP vem da tabela de
 * settings (categoria "email") e, onde estiver vazia, das propriedades
 * {@code itdesk.mail.*}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailService {

    static final String DEFAULT_SENDER_NAME = "IT Support Team";
    static final int DEFAULT_PORT = 587;
    private static final int TIMEOUT_MS = 10_000;

    static final String DEFAULT_CREATED_SUBJECT = "New Support Ticket Created - #{ticketNumber}";
    static final String DEFAULT_CREATED_BODY = "Dear {employeeName},\n"
            + "\n"
            + "Your support ticket has been successfully created.\n"
            + "\n"
            + "Ticket Details:\n"
            + "- Ticket Number: {ticketNumber}\n"
            + "- Title: {title}\n"
            + "- Priority: {priority}\n"
            + "- Status: {status}\n"
            + "\n"
            + "We will review your ticket and respond as soon as possible.\n"
            + "\n"
            + "Best regards,\n"
            + "IT Support Team";

    static final String DEFAULT_UPDATED_SUBJECT = "Ticket Status Updated - #{ticketNumber}";
    static final String DEFAULT_UPDATED_BODY = "Dear {employeeName},\n"
            + "\n"
            + "The status of your support ticket {ticketNumber} has changed from {oldStatus} to {newStatus}.\n"
            + "\n"
            + "Title: {title}\n"
            + "Updated by: {updatedBy}\n"
            + "\n"
            + "Best regards,\n"
            + "IT Support Team";

    static final String DEFAULT_COMMENT_SUBJECT = "New Comment on Ticket - #{ticketNumber}";
    static final String DEFAULT_COMMENT_BODY = "Dear {employeeName},\n"
            + "\n"
            + "{commentAuthor} added a comment to your support ticket {ticketNumber}:\n"
            + "\n"
            + "{commentContent}\n"
            + "\n"
            + "Best regards,\n"
            + "IT Support Team";

    private static final String TEST_EMAIL_BODY = "This is a test email from your IT Support ticketing system.\n"
            + "\n"
            + "If you received this email, your SMTP configuration is working correctly!\n"
            + "\n"
            + "Configuration details:\n"
            + "- SMTP Host: %s\n"
            + "- SMTP Port: %d\n"
            + "- Sender: %s <%s>\n"
            + "\n"
            + "Best regards,\n"
            + "%s";

    private final SettingService settingService;
    private final EmailTemplateRenderer renderer;

    @Value("${itdesk.mail.host:}")
    private String fallbackHost;

    @Value("${itdesk.mail.port:587}")
    private int fallbackPort;

    @Value("${itdesk.mail.username:}")
    private String fallbackUsername;

    @Value("${itdesk.mail.password:}")
    private String fallbackPassword;

    @Value("${itdesk.mail.sender-email:}")
    private String fallbackSenderEmail;

    public record MailSettings(String host, int port, String username, String password,
                               String senderName, String senderEmail, String itTeamEmail) {

        String from() {
            return senderEmail != null && !senderEmail.isBlank() ? senderEmail : username;
        }

        boolean isComplete() {
            return notBlank(host) && notBlank(username) && notBlank(password);
        }
    }

    public record OutgoingMail(String to, String subject, String text, String html) {}

    /** Configuração atual, ou vazio quando as notificações estão desligadas. */
    public Optional<MailSettings> activeSettings() {
        Map<String, String> values = settingService.asMap(SettingService.EMAIL_CATEGORY);
        if (!"true".equalsIgnoreCase(values.get("email_notifications_enabled"))) {
            return Optional.empty();
        }
        return Optional.of(fromValues(values));
    }

    /** Mensagens geradas por um evento: o solicitante e, na abertura, a cópia para a equipe de TI. */
    public List<OutgoingMail> compose(TicketNotificationEvent event, MailSettings settings) {
        Map<String, String> templates = settingService.asMap(SettingService.EMAIL_CATEGORY);
        List<OutgoingMail> mails = new ArrayList<>();

        String subjectTemplate;
        String bodyTemplate;
        switch (event.type()) {
            case TICKET_CREATED:
                subjectTemplate = blankToDefault(templates.get("ticket_created_subject"), DEFAULT_CREATED_SUBJECT);
                bodyTemplate = blankToDefault(templates.get("ticket_created_body"), DEFAULT_CREATED_BODY);
                break;
            case STATUS_CHANGED:
                subjectTemplate = blankToDefault(templates.get("ticket_updated_subject"), DEFAULT_UPDATED_SUBJECT);
                bodyTemplate = blankToDefault(templates.get("ticket_updated_body"), DEFAULT_UPDATED_BODY);
                break;
            default:
                subjectTemplate = blankToDefault(templates.get("comment_added_subject"), DEFAULT_COMMENT_SUBJECT);
                bodyTemplate = blankToDefault(templates.get("comment_added_body"), DEFAULT_COMMENT_BODY);
                break;
        }

        String subject = renderer.render(subjectTemplate, event.fields());
        String body = renderer.render(bodyTemplate, event.fields());

        if (notBlank(event.recipient())) {
            mails.add(new OutgoingMail(event.recipient(), subject, body, renderer.toHtml(body)));
        }
        if (event.type() == TicketNotificationEvent.Type.TICKET_CREATED && notBlank(settings.itTeamEmail())) {
            mails.add(new OutgoingMail(
                    settings.itTeamEmail(),
                    "[IT NOTIFICATION] " + subject,
                    "IT Team Notification:\n\n" + body,
                    renderer.toHtml("<strong>IT Team Notification:</strong>\n\n" + body)));
        }
        return mails;
    }

    /** Envia uma mensagem; falhas sobem para quem chamou decidir se tenta de novo. */
    public void send(MailSettings settings, OutgoingMail mail) {
        if (!settings.isComplete()) {
            throw new MailConfigurationException("SMTP configuration is incomplete. Please fill in Host, Username, and Password fields.");
        }
        JavaMailSender sender = createSender(settings);
        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(settings.from(), settings.senderName());
            helper.setTo(mail.to());
            helper.setSubject(mail.subject());
            helper.setText(mail.text(), mail.html());
            sender.send(message);
        } catch (MessagingException | UnsupportedEncodingException e) {
            throw new EmailDeliveryException("Could not build email to " + mail.to() + ": " + e.getMessage(), e);
        } catch (MailException e) {
            throw new EmailDeliveryException("Failed to send email to " + mail.to() + ": " + e.getMessage(), e);
        }
        log.info("Email '{}' sent to {}", mail.subject(), mail.to());
    }

    /**
     * Envio síncrono para validar a configuração SMTP. Usa a configuração
     * recebida da tela, quando houver, sem gravá-la.
     */
    public void sendTestEmail(String to, SmtpOverride override) {
        MailSettings settings;
        if (override != null) {
            settings = fromOverride(override);
        } else {
            settings = activeSettings().orElseThrow(() ->
                    new MailConfigurationException("Email notifications are disabled or not configured"));
        }

        String text = String.format(TEST_EMAIL_BODY, settings.host(), settings.port(), settings.senderName(),
                settings.from(), settings.senderName());

        send(settings, new OutgoingMail(to, "IT Support System - Test Email Configuration", text, renderer.toHtml(text)));
    }

    JavaMailSender createSender(MailSettings settings) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(settings.host());
        sender.setPort(settings.port());
        sender.setUsername(settings.username());
        sender.setPassword(settings.password());
        sender.setDefaultEncoding("UTF-8");

        Properties props = sender.getJavaMailProperties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.connectiontimeout", String.valueOf(TIMEOUT_MS));
        props.put("mail.smtp.timeout", String.valueOf(TIMEOUT_MS));
        props.put("mail.smtp.writetimeout", String.valueOf(TIMEOUT_MS));
        if (settings.port() == 465) {
            props.put("mail.smtp.ssl.enable", "true");
        } else if (settings.port() == 587) {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        }
        return sender;
    }

    MailSettings fromValues(Map<String, String> values) {
        return new MailSettings(
                blankToDefault(values.get("smtp_host"), fallbackHost),
                parsePort(values.get("smtp_port"), fallbackPort),
                blankToDefault(values.get("smtp_username"), fallbackUsername),
                blankToDefault(values.get("smtp_password"), fallbackPassword),
                blankToDefault(values.get("sender_name"), DEFAULT_SENDER_NAME),
                blankToDefault(values.get("sender_email"), fallbackSenderEmail),
                values.get("it_team_email"));
    }

    private MailSettings fromOverride(SmtpOverride override) {
        return new MailSettings(
                blankToDefault(override.smtpHost(), fallbackHost),
                parsePort(override.smtpPort(), fallbackPort),
                blankToDefault(override.smtpUsername(), fallbackUsername),
                blankToDefault(override.smtpPassword(), fallbackPassword),
                blankToDefault(override.senderName(), DEFAULT_SENDER_NAME),
                blankToDefault(override.senderEmail(), fallbackSenderEmail),
                override.itTeamEmail());
    }

    private static int parsePort(String value, int fallback) {
        if (!notBlank(value)) {
            return fallback > 0 ? fallback : DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid smtp_port '{}', using {}", value, DEFAULT_PORT);
            return DEFAULT_PORT;
        }
    }

    private static String blankToDefault(String value, String fallback) {
        return notBlank(value) ? value : fallback;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
