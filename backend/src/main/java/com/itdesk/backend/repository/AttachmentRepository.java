package com.itdesk.backend.repository;

import com.itdesk.backend.domain.Attachment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {

    List<Attachment> findByTicketIdOrderByCreatedAtAsc(UUID ticketId);

    boolean existsByUploadedById(UUID userId);
}
