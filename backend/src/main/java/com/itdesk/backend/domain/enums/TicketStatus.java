package com.itdesk.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TicketStatus {
    OPEN,
    IN_PROGRESS,
    ON_HOLD,
    RESOLVED,
    CLOSED;

    /** Resolved e closed carimbam resolvedAt e param o relógio de SLA. */
    public boolean isFinished() {
        return this == RESOLVED || this == CLOSED;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TicketStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return TicketStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
