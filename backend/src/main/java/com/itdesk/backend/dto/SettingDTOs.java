package com.itdesk.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class SettingDTOs {

    public record SettingRequest(@NotBlank String key, @NotNull String value, String category, String description) {}

    public record SettingValueRequest(@NotBlank(message = "Value is required") String value) {}

    public record BulkSettingsRequest(@NotNull(message = "Settings must be an array") List<@Valid SettingRequest> settings) {}

    /** Configuração SMTP enviada pela tela antes de salvar, para testar sem persistir. */
    public record SmtpOverride(String smtpHost, String smtpPort, String smtpUsername, String smtpPassword,
                               String senderName, String senderEmail, String itTeamEmail) {}

    public record TestEmailRequest(@NotBlank(message = "Email address is required") @Email(message = "Invalid email address") String email,
                                   SmtpOverride settings) {}
}
