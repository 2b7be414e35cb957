package com.itdesk.backend.exception;

/** Configuração de SMTP ausente ou incompleta; não adianta tentar de novo. */
public class MailConfigurationException extends RuntimeException {

    public MailConfigurationException(String message) {
        super(message);
    }
}
