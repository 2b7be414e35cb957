package com.itdesk.backend.service;

import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import com.itdesk.backend.dto.SlaProgress;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Regras de ciclo de vida do chamado: prazo de SLA por prioridade, carimbo de
 * resolução e progresso do SLA para exibição.
 *
 * <p>Nenhuma transição de status é bloqueada: um chamado fechado pode ser reaberto
 * pelo mesmo caminho de atualização.</p>
 */
@Component
@RequiredArgsConstructor
public class TicketLifecycle {

    static final int WARNING_THRESHOLD = 50;
    static final int DANGER_THRESHOLD = 75;

    private final Clock clock;

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public static String formatTicketNumber(long sequence) {
        return String.format("TKT-%03d", sequence);
    }

    public static LocalDateTime slaDeadline(TicketPriority priority, LocalDateTime createdAt) {
        return createdAt.plus(priority.slaWindow());
    }

    /** Preenche datas, status inicial e prazo de SLA de um chamado novo. */
    public void initialize(Ticket ticket, String ticketNumber) {
        LocalDateTime now = now();
        ticket.setTicketNumber(ticketNumber);
        ticket.setStatus(TicketStatus.OPEN);
        ticket.setCreatedAt(now);
        ticket.setUpdatedAt(now);
        ticket.setResolvedAt(null);
        ticket.setSlaDeadline(slaDeadline(ticket.getPriority(), now));
    }

    /**
     * Aplica o status recebido. Resolved/closed sempre carimbam resolvedAt;
     * os demais status preservam o valor anterior.
     *
     * @return o status anterior
     */
    public TicketStatus applyStatus(Ticket ticket, TicketStatus newStatus) {
        TicketStatus previous = ticket.getStatus();
        LocalDateTime now = now();
        ticket.setStatus(newStatus);
        if (newStatus.isFinished()) {
            ticket.setResolvedAt(now);
        }
        ticket.setUpdatedAt(now);
        return previous;
    }

    /** Mudança de prioridade recalcula o prazo a partir da abertura. */
    public void applyPriority(Ticket ticket, TicketPriority priority) {
        ticket.setPriority(priority);
        ticket.setSlaDeadline(slaDeadline(priority, ticket.getCreatedAt()));
        ticket.setUpdatedAt(now());
    }

    public void touch(Ticket ticket) {
        ticket.setUpdatedAt(now());
    }

    public boolean isSlaBreached(Ticket ticket) {
        return !ticket.getStatus().isFinished()
                && ticket.getSlaDeadline() != null
                && ticket.getSlaDeadline().isBefore(now());
    }

    public SlaProgress slaProgress(Ticket ticket) {
        if (ticket.getSlaDeadline() == null) {
            return null;
        }
        if (ticket.getStatus() != null && ticket.getStatus().isFinished()) {
            return new SlaProgress(100, "Completed", SlaProgress.State.COMPLETED);
        }

        LocalDateTime now = now();
        Duration remaining = Duration.between(now, ticket.getSlaDeadline());
        if (remaining.isZero() || remaining.isNegative()) {
            return new SlaProgress(100, "Expired", SlaProgress.State.EXPIRED);
        }

        long windowMillis = Duration.between(ticket.getCreatedAt(), ticket.getSlaDeadline()).toMillis();
        long elapsedMillis = windowMillis - remaining.toMillis();
        int percentage = windowMillis <= 0 ? 100
                : (int) Math.max(0, Math.min(100, elapsedMillis * 100 / windowMillis));

        SlaProgress.State state;
        if (percentage >= DANGER_THRESHOLD) {
            state = SlaProgress.State.DANGER;
        } else if (percentage >= WARNING_THRESHOLD) {
            state = SlaProgress.State.WARNING;
        } else {
            state = SlaProgress.State.GOOD;
        }
        return new SlaProgress(percentage, formatRemaining(remaining), state);
    }

    static String formatRemaining(Duration remaining) {
        long hours = remaining.toHours();
        long minutes = remaining.toMinutesPart();
        if (hours >= 1) {
            return hours + "h " + minutes + "m";
        }
        return remaining.toMinutes() + "m";
    }
}
