package com.itdesk.backend.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    ADMIN,
    AGENT,
    MANAGER,  // "viewer" no formulário de usuários: enxerga tudo, só altera o que é dele
    EMPLOYEE; // "user" no formulário de usuários

    public boolean isStaff() {
        return this == ADMIN || this == AGENT;
    }

    public boolean seesAllTickets() {
        return this != EMPLOYEE;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "VIEWER":
                return MANAGER;
            case "USER":
                return EMPLOYEE;
            default:
                return Role.valueOf(normalized);
        }
    }
}
