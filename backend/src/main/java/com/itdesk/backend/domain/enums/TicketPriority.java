package com.itdesk.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

public enum TicketPriority {
    LOW(72),
    MEDIUM(24),
    HIGH(4),
    CRITICAL(1);

    private final int slaHours;

    TicketPriority(int slaHours) {
        this.slaHours = slaHours;
    }

    public Duration slaWindow() {
        return Duration.ofHours(slaHours);
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TicketPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return TicketPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
