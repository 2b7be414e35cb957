package com.itdesk.backend.dto;

import com.itdesk.backend.domain.Attachment;
import com.itdesk.backend.domain.AuditLog;
import com.itdesk.backend.domain.Comment;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public class TicketDTOs {

    /**
     * Dados do solicitante são opcionais: quando ausentes, vêm do perfil de quem abre o chamado.
     */
    public record CreateTicketRequest(
        @NotBlank @Size(max = 255) String title,
        @NotBlank @Size(max = 10000) String description,
        @NotBlank String category,
        @NotNull TicketPriority priority,
        String employeeId,
        String employeeName,
        @Email String employeeEmail,
        String employeeMobile,
        String employeeDepartment,
        UUID assignedToId
    ) {}

    public record UpdateTicketRequest(
        @Size(max = 255) String title,
        @Size(max = 10000) String description,
        String category,
        TicketPriority priority,
        TicketStatus status,
        UUID assignedToId,
        Boolean unassign
    ) {}

    public record CommentRequest(@NotBlank String content, Boolean isInternal) {}

    public record CommentResponse(UUID id, UUID ticketId, UUID userId, String userName, String content,
                                  boolean isInternal, LocalDateTime createdAt) {
        public static CommentResponse from(Comment comment) {
            return new CommentResponse(
                comment.getId(),
                comment.getTicket().getId(),
                comment.getUser().getId(),
                comment.getUser().getName(),
                comment.getContent(),
                comment.isInternal(),
                comment.getCreatedAt()
            );
        }
    }

    public record AttachmentResponse(UUID id, UUID ticketId, String filename, String originalName, String mimeType,
                                     long size, UUID uploadedById, LocalDateTime createdAt) {
        public static AttachmentResponse from(Attachment attachment) {
            return new AttachmentResponse(
                attachment.getId(),
                attachment.getTicket().getId(),
                attachment.getFilename(),
                attachment.getOriginalName(),
                attachment.getMimeType(),
                attachment.getSize(),
                attachment.getUploadedBy().getId(),
                attachment.getCreatedAt()
            );
        }
    }

    public record AuditLogResponse(UUID id, UUID ticketId, UUID userId, String action, String oldValue,
                                   String newValue, LocalDateTime createdAt) {
        public static AuditLogResponse from(AuditLog log) {
            return new AuditLogResponse(
                log.getId(),
                log.getTicket().getId(),
                log.getUserId(),
                log.getAction(),
                log.getOldValue(),
                log.getNewValue(),
                log.getCreatedAt()
            );
        }
    }

    public record TicketPage(List<TicketResponse> tickets, long total, int page, int limit) {}

    public record TicketDetail(TicketResponse ticket, List<CommentResponse> comments,
                               List<AttachmentResponse> attachments, List<AuditLogResponse> auditLogs) {}

    public record TicketStats(long total, long open, long inProgress, long onHold, long resolved, long closed,
                              long slaBreaches) {}
}
