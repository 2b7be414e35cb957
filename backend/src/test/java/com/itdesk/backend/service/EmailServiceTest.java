package com.itdesk.backend.service;

import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import com.itdesk.backend.exception.MailConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailServiceTest {

    @Mock
    private SettingService settingService;

    private EmailService emailService;

    private Map<String, String> emailSettings;

    @BeforeEach
    void setUp() {
        emailService = new EmailService(settingService, new EmailTemplateRenderer());
        emailSettings = new HashMap<>();
        emailSettings.put("email_notifications_enabled", "true");
        emailSettings.put("smtp_host", "smtp.company.com");
        emailSettings.put("smtp_port", "465");
        emailSettings.put("smtp_username", "helpdesk");
        emailSettings.put("smtp_password", "secret");
    }

    private Ticket ticket() {
        Ticket ticket = new Ticket();
        ticket.setTicketNumber("TKT-012");
        ticket.setTitle("VPN down");
        ticket.setDescription("Cannot connect");
        ticket.setCategory("network");
        ticket.setPriority(TicketPriority.HIGH);
        ticket.setStatus(TicketStatus.OPEN);
        ticket.setEmployeeId("EMP010");
        ticket.setEmployeeName("Ana Lima");
        ticket.setEmployeeEmail("ana@company.com");
        return ticket;
    }

    @Test
    void disabledNotificationsYieldNoSettings() {
        emailSettings.put("email_notifications_enabled", "false");
        when(settingService.asMap(SettingService.EMAIL_CATEGORY)).thenReturn(emailSettings);

        assertThat(emailService.activeSettings()).isEmpty();
    }

    @Test
    void settingsFallBackToDefaults() {
        emailSettings.remove("smtp_port");
        when(settingService.asMap(SettingService.EMAIL_CATEGORY)).thenReturn(emailSettings);

        EmailService.MailSettings settings = emailService.activeSettings().orElseThrow();

        assertThat(settings.port()).isEqualTo(587);
        assertThat(settings.senderName()).isEqualTo("IT Support Team");
        assertThat(settings.from()).isEqualTo("helpdesk");
    }

    @Test
    void ticketCreatedGoesToRequesterAndItTeam() {
        emailSettings.put("it_team_email", "it@company.com");
        emailSettings.put("ticket_created_subject", "Created {ticketNumber} ({priority})");
        when(settingService.asMap(SettingService.EMAIL_CATEGORY)).thenReturn(emailSettings);
        EmailService.MailSettings settings = emailService.fromValues(emailSettings);

        List<EmailService.OutgoingMail> mails =
                emailService.compose(TicketNotificationEvent.created(ticket()), settings);

        assertThat(mails).hasSize(2);
        assertThat(mails.get(0).to()).isEqualTo("ana@company.com");
        assertThat(mails.get(0).subject()).isEqualTo("Created TKT-012 (high)");
        assertThat(mails.get(0).text()).contains("Dear Ana Lima,").contains("- Title: VPN down");
        assertThat(mails.get(1).to()).isEqualTo("it@company.com");
        assertThat(mails.get(1).subject()).isEqualTo("[IT NOTIFICATION] Created TKT-012 (high)");
    }

    @Test
    void statusChangeUsesEventFields() {
        when(settingService.asMap(SettingService.EMAIL_CATEGORY)).thenReturn(emailSettings);
        Ticket ticket = ticket();
        ticket.setStatus(TicketStatus.RESOLVED);
        User agent = new User();
        agent.setName("Sam Agent");

        List<EmailService.OutgoingMail> mails = emailService.compose(
                TicketNotificationEvent.statusChanged(ticket, TicketStatus.OPEN, agent),
                emailService.fromValues(emailSettings));

        assertThat(mails).singleElement().satisfies(mail -> {
            assertThat(mail.subject()).isEqualTo("Ticket Status Updated - #TKT-012");
            assertThat(mail.text()).contains("from open to resolved").contains("Updated by: Sam Agent");
        });
    }

    @Test
    void portsSelectSslOrStartTls() {
        JavaMailSenderImpl ssl = (JavaMailSenderImpl) emailService.createSender(emailService.fromValues(emailSettings));
        assertThat(ssl.getJavaMailProperties().getProperty("mail.smtp.ssl.enable")).isEqualTo("true");

        emailSettings.put("smtp_port", "587");
        JavaMailSenderImpl tls = (JavaMailSenderImpl) emailService.createSender(emailService.fromValues(emailSettings));
        assertThat(tls.getJavaMailProperties().getProperty("mail.smtp.starttls.required")).isEqualTo("true");
        assertThat(tls.getJavaMailProperties().getProperty("mail.smtp.timeout")).isEqualTo("10000");
    }

    @Test
    void incompleteConfigurationFailsFast() {
        emailSettings.remove("smtp_password");
        EmailService.MailSettings settings = emailService.fromValues(emailSettings);

        assertThatThrownBy(() -> emailService.send(settings,
                new EmailService.OutgoingMail("ana@company.com", "s", "t", "<p>t</p>")))
                .isInstanceOf(MailConfigurationException.class)
                .hasMessageContaining("incomplete");
    }
}
