package com.itdesk.backend.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Progresso do SLA para exibição, calculado sobre a janela real do chamado
 * (createdAt até slaDeadline).
 */
public record SlaProgress(int percentage, String timeLeft, State state) {

    public enum State {
        GOOD, WARNING, DANGER, EXPIRED, COMPLETED;

        @JsonValue
        public String toJson() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
