package com.itdesk.backend.service;

import com.itdesk.backend.domain.AuditLog;
import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.dto.TicketDTOs.AuditLogResponse;
import com.itdesk.backend.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Histórico de alterações de cada chamado. A gravação é best-effort: acontece
 * depois do commit da operação principal, em transação própria, e uma falha
 * aqui só é registrada no log.
 */
@Service
@Slf4j
public class AuditService {

    public static final String CREATED = "created";
    public static final String STATUS_CHANGED = "status_changed";
    public static final String PRIORITY_CHANGED = "priority_changed";
    public static final String ASSIGNED = "assigned";
    public static final String COMMENT_ADDED = "comment_added";
    public static final String ATTACHMENT_ADDED = "attachment_added";

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate auditTransaction;

    public AuditService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void log(Ticket ticket, User actor, String action, String oldValue, String newValue) {
        AuditLog entry = new AuditLog();
        entry.setTicket(ticket);
        entry.setUserId(actor != null ? actor.getId() : null);
        entry.setAction(action);
        entry.setOldValue(oldValue);
        entry.setNewValue(newValue);

        // Se a operação principal fizer rollback, o registro não é gravado
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(entry, ticket);
                }
            });
        } else {
            write(entry, ticket);
        }
    }

    private void write(AuditLog entry, Ticket ticket) {
        try {
            auditTransaction.executeWithoutResult(status -> auditLogRepository.save(entry));
        } catch (RuntimeException e) {
            log.error("Failed to write audit log '{}' for ticket {}: {}",
                    entry.getAction(), ticket.getTicketNumber(), e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<AuditLogResponse> history(UUID ticketId) {
        return auditLogRepository.findByTicketIdOrderByCreatedAtDesc(ticketId).stream()
                .map(AuditLogResponse::from)
                .toList();
    }
}
