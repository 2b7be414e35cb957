package com.itdesk.backend.repository;

import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.UUID;

/**
 * Filtros combináveis da listagem de chamados. Cada método devolve {@code null}
 * quando o filtro não foi informado, e o Spring Data ignora specs nulas.
 */
public final class TicketSpecifications {

    private TicketSpecifications() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Specification<Ticket> matching(TicketFilter filter) {
        return Specification.where(hasStatus(filter.status()))
                .and(hasPriority(filter.priority()))
                .and(inDepartment(filter.department()))
                .and(assignedTo(filter.assignedToId()))
                .and(createdBy(filter.createdById()))
                .and(containsText(filter.search()));
    }

    public static Specification<Ticket> hasStatus(TicketStatus status) {
        return status == null ? null : (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Ticket> hasPriority(TicketPriority priority) {
        return priority == null ? null : (root, query, cb) -> cb.equal(root.get("priority"), priority);
    }

    public static Specification<Ticket> inDepartment(String department) {
        return isBlank(department) ? null : (root, query, cb) -> cb.equal(root.get("employeeDepartment"), department);
    }

    public static Specification<Ticket> assignedTo(UUID userId) {
        return userId == null ? null : (root, query, cb) -> cb.equal(root.get("assignedTo").get("id"), userId);
    }

    public static Specification<Ticket> createdBy(UUID userId) {
        return userId == null ? null : (root, query, cb) -> cb.equal(root.get("createdBy").get("id"), userId);
    }

    /** Busca parcial, sem diferenciar maiúsculas, em título, descrição, número e solicitante. */
    public static Specification<Ticket> containsText(String search) {
        if (isBlank(search)) {
            return null;
        }
        String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("title")), pattern),
                cb.like(cb.lower(root.get("description")), pattern),
                cb.like(cb.lower(root.get("ticketNumber")), pattern),
                cb.like(cb.lower(root.get("employeeName")), pattern)
        );
    }

    /** Chamado em aberto (nem resolved nem closed) com prazo de SLA já vencido. */
    public static Specification<Ticket> slaBreachedAt(LocalDateTime now) {
        EnumSet<TicketStatus> finished = EnumSet.of(TicketStatus.RESOLVED, TicketStatus.CLOSED);
        return (root, query, cb) -> cb.and(
                cb.not(root.get("status").in(finished)),
                cb.isNotNull(root.get("slaDeadline")),
                cb.lessThan(root.get("slaDeadline"), now)
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
