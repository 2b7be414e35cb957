package com.itdesk.backend.service;

import com.itdesk.backend.domain.AuditLog;
import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.repository.AuditLogRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuditService auditService;
    private Ticket ticket;
    private User agent;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(auditLogRepository, transactionManager);
        ticket = new Ticket();
        ticket.setId(UUID.randomUUID());
        ticket.setTicketNumber("TKT-031");
        agent = new User();
        agent.setId(UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void writesEntryImmediatelyOutsideTransaction() {
        auditService.log(ticket, agent, AuditService.STATUS_CHANGED, "open", "in_progress");

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertThat(captor.getValue().getTicket()).isSameAs(ticket);
        assertThat(captor.getValue().getUserId()).isEqualTo(agent.getId());
        assertThat(captor.getValue().getAction()).isEqualTo("status_changed");
        assertThat(captor.getValue().getOldValue()).isEqualTo("open");
        assertThat(captor.getValue().getNewValue()).isEqualTo("in_progress");
    }

    @Test
    void waitsForCommitInsideTransaction() {
        TransactionSynchronizationManager.initSynchronization();

        auditService.log(ticket, agent, AuditService.CREATED, null, "open");

        verify(auditLogRepository, never()).save(any());
        assertThat(TransactionSynchronizationManager.getSynchronizations()).hasSize(1);

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        verify(auditLogRepository).save(any(AuditLog.class));
    }

    @Test
    void rolledBackOperationLeavesNoEntry() {
        TransactionSynchronizationManager.initSynchronization();

        auditService.log(ticket, agent, AuditService.CREATED, null, "open");

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }
        verify(auditLogRepository, never()).save(any());
    }

    @Test
    void writeFailureIsSwallowed() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new DataIntegrityViolationException("audit_logs unavailable"));

        assertThatCode(() -> auditService.log(ticket, null, AuditService.COMMENT_ADDED, null, "public"))
                .doesNotThrowAnyException();
        verify(transactionManager).rollback(any());
    }
}
