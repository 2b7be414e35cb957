package com.itdesk.backend.repository;

import com.itdesk.backend.domain.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    // Histórico do chamado, mais recente primeiro
    List<AuditLog> findByTicketIdOrderByCreatedAtDesc(UUID ticketId);
}
