package com.itdesk.backend.repository;

import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;

import java.util.UUID;

public record TicketFilter(
    TicketStatus status,
    TicketPriority priority,
    String department,
    UUID assignedToId,
    UUID createdById,
    String search
) {
    public static TicketFilter none() {
        return new TicketFilter(null, null, null, null, null, null);
    }

    public TicketFilter withCreatedBy(UUID userId) {
        return new TicketFilter(status, priority, department, assignedToId, userId, search);
    }
}
