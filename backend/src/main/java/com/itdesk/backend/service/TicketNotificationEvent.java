package com.itdesk.backend.service;

import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.TicketStatus;

import java.util.HashMap;
import java.util.Map;

/**
 * Evento publicado dentro da transação do chamado. Carrega uma cópia dos campos
 * usados nos templates, pois o envio acontece em outra thread depois do commit.
 */
public record TicketNotificationEvent(Type type, String recipient, Map<String, String> fields) {

    public enum Type {
        TICKET_CREATED,
        STATUS_CHANGED,
        COMMENT_ADDED
    }

    public static TicketNotificationEvent created(Ticket ticket) {
        return new TicketNotificationEvent(Type.TICKET_CREATED, ticket.getEmployeeEmail(), ticketFields(ticket));
    }

    public static TicketNotificationEvent statusChanged(Ticket ticket, TicketStatus oldStatus, User updatedBy) {
        Map<String, String> fields = ticketFields(ticket);
        fields.put("oldStatus", oldStatus.toJson());
        fields.put("newStatus", ticket.getStatus().toJson());
        fields.put("updatedBy", updatedBy.getName());
        return new TicketNotificationEvent(Type.STATUS_CHANGED, ticket.getEmployeeEmail(), fields);
    }

    public static TicketNotificationEvent commentAdded(Ticket ticket, User author, String content) {
        Map<String, String> fields = ticketFields(ticket);
        fields.put("commentAuthor", author.getName());
        fields.put("commentContent", content);
        return new TicketNotificationEvent(Type.COMMENT_ADDED, ticket.getEmployeeEmail(), fields);
    }

    private static Map<String, String> ticketFields(Ticket ticket) {
        Map<String, String> fields = new HashMap<>();
        fields.put("ticketNumber", ticket.getTicketNumber());
        fields.put("title", ticket.getTitle());
        fields.put("description", ticket.getDescription());
        fields.put("category", ticket.getCategory());
        fields.put("priority", ticket.getPriority().toJson());
        fields.put("status", ticket.getStatus().toJson());
        fields.put("employeeId", ticket.getEmployeeId());
        fields.put("employeeName", ticket.getEmployeeName());
        fields.put("employeeEmail", ticket.getEmployeeEmail());
        fields.put("employeeMobile", ticket.getEmployeeMobile());
        fields.put("employeeDepartment", ticket.getEmployeeDepartment());
        if (ticket.getAssignedTo() != null) {
            fields.put("assignedTo", ticket.getAssignedTo().getName());
        }
        if (ticket.getSlaDeadline() != null) {
            fields.put("slaDeadline", ticket.getSlaDeadline().toString());
        }
        return fields;
    }
}
