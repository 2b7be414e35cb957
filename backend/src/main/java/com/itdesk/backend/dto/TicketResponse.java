package com.itdesk.backend.dto;

import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record TicketResponse(
    UUID id,
    String ticketNumber,
    String title,
    String description,
    String category,
    TicketPriority priority,
    TicketStatus status,
    String employeeId,
    String employeeName,
    String employeeEmail,
    String employeeMobile,
    String employeeDepartment,
    UUID assignedToId,
    String assignedToName,
    UUID createdById,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    LocalDateTime resolvedAt,
    LocalDateTime slaDeadline,
    SlaProgress sla
) {
    public static TicketResponse from(Ticket ticket, SlaProgress sla) {
        User assignee = ticket.getAssignedTo();
        return new TicketResponse(
            ticket.getId(),
            ticket.getTicketNumber(),
            ticket.getTitle(),
            ticket.getDescription(),
            ticket.getCategory(),
            ticket.getPriority(),
            ticket.getStatus(),
            ticket.getEmployeeId(),
            ticket.getEmployeeName(),
            ticket.getEmployeeEmail(),
            ticket.getEmployeeMobile(),
            ticket.getEmployeeDepartment(),
            assignee != null ? assignee.getId() : null,
            assignee != null ? assignee.getName() : null,
            ticket.getCreatedBy().getId(),
            ticket.getCreatedAt(),
            ticket.getUpdatedAt(),
            ticket.getResolvedAt(),
            ticket.getSlaDeadline(),
            sla
        );
    }
}
