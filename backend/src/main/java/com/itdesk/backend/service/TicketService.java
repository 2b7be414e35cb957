package com.itdesk.backend.service;

import com.itdesk.backend.domain.Attachment;
import com.itdesk.backend.domain.Comment;
import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;
import com.itdesk.backend.domain.enums.TicketStatus;
import com.itdesk.backend.dto.TicketDTOs.AttachmentResponse;
import com.itdesk.backend.dto.TicketDTOs.AuditLogResponse;
import com.itdesk.backend.dto.TicketDTOs.CommentRequest;
import com.itdesk.backend.dto.TicketDTOs.CommentResponse;
import com.itdesk.backend.dto.TicketDTOs.CreateTicketRequest;
import com.itdesk.backend.dto.TicketDTOs.TicketDetail;
import com.itdesk.backend.dto.TicketDTOs.TicketPage;
import com.itdesk.backend.dto.TicketDTOs.TicketStats;
import com.itdesk.backend.dto.TicketDTOs.UpdateTicketRequest;
import com.itdesk.backend.dto.TicketResponse;
import com.itdesk.backend.exception.BadRequestException;
import com.itdesk.backend.exception.ResourceNotFoundException;
import com.itdesk.backend.repository.AttachmentRepository;
import com.itdesk.backend.repository.CommentRepository;
import com.itdesk.backend.repository.TicketFilter;
import com.itdesk.backend.repository.TicketRepository;
import com.itdesk.backend.repository.TicketSpecifications;
import com.itdesk.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class TicketService {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    private final TicketRepository ticketRepository;
    private final UserRepository userRepository;
    private final CommentRepository commentRepository;
    private final AttachmentRepository attachmentRepository;
    private final TicketNumberGenerator numberGenerator;
    private final TicketLifecycle lifecycle;
    private final AuditService auditService;
    private final FileStorageService fileStorage;
    private final ApplicationEventPublisher eventPublisher;

    public record AttachmentDownload(Attachment attachment, Resource resource) {}

    @Transactional(readOnly = true)
    public TicketPage list(User viewer, TicketFilter filter, Integer page, Integer limit) {
        int pageNumber = page == null || page < 1 ? 1 : page;
        int pageSize = limit == null || limit < 1 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);

        Page<Ticket> result = ticketRepository.findAll(
                TicketSpecifications.matching(scope(viewer, filter)),
                PageRequest.of(pageNumber - 1, pageSize, Sort.by(Sort.Direction.DESC, "createdAt")));

        List<TicketResponse> tickets = result.getContent().stream().map(this::toResponse).toList();
        return new TicketPage(tickets, result.getTotalElements(), pageNumber, pageSize);
    }

    @Transactional(readOnly = true)
    public TicketDetail getDetail(User viewer, UUID ticketId) {
        Ticket ticket = findVisible(viewer, ticketId);

        List<Comment> comments = viewer.getRole() == Role.EMPLOYEE
                ? commentRepository.findByTicketIdAndInternalFalseOrderByCreatedAtAsc(ticketId)
                : commentRepository.findByTicketIdOrderByCreatedAtAsc(ticketId);

        return new TicketDetail(
                toResponse(ticket),
                comments.stream().map(CommentResponse::from).toList(),
                attachmentRepository.findByTicketIdOrderByCreatedAtAsc(ticketId).stream()
                        .map(AttachmentResponse::from).toList(),
                auditService.history(ticketId));
    }

    @Transactional
    public TicketResponse create(User creator, CreateTicketRequest request, List<MultipartFile> files) {
        List<MultipartFile> uploads = nonEmpty(files);
        uploads.forEach(fileStorage::validate);

        Ticket ticket = new Ticket();
        ticket.setTitle(request.title());
        ticket.setDescription(request.description());
        ticket.setCategory(request.category());
        ticket.setPriority(request.priority());
        ticket.setCreatedBy(creator);
        if (request.assignedToId() != null) {
            ticket.setAssignedTo(findAssignee(request.assignedToId()));
        }

        // snapshot do solicitante; o que não vier no pedido sai do perfil de quem abriu
        ticket.setEmployeeId(firstNonBlank(request.employeeId(), creator.getEmployeeId()));
        ticket.setEmployeeName(firstNonBlank(request.employeeName(), creator.getName()));
        ticket.setEmployeeEmail(firstNonBlank(request.employeeEmail(), creator.getEmail()));
        ticket.setEmployeeMobile(firstNonBlank(request.employeeMobile(), creator.getMobile()));
        ticket.setEmployeeDepartment(firstNonBlank(request.employeeDepartment(), creator.getDepartment()));

        lifecycle.initialize(ticket, numberGenerator.next());
        ticket = ticketRepository.save(ticket);

        auditService.log(ticket, creator, AuditService.CREATED, null, ticket.getStatus().toJson());
        storeAttachments(ticket, creator, uploads);

        eventPublisher.publishEvent(TicketNotificationEvent.created(ticket));
        log.info("Ticket {} created by {} (priority {}, SLA deadline {})",
                ticket.getTicketNumber(), creator.getUsername(), ticket.getPriority().toJson(), ticket.getSlaDeadline());
        return toResponse(ticket);
    }

    /**
     * Atualização parcial. O chamado é lido com lock, então o status anterior
     * comparado aqui é o que está sendo substituído, mesmo com atualizações
     * concorrentes.
     */
    @Transactional
    public TicketResponse update(User actor, UUID ticketId, UpdateTicketRequest request) {
        Ticket ticket = ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(() -> ResourceNotFoundException.of("Ticket"));

        if (!actor.getRole().isStaff() && !isCreator(actor, ticket)) {
            throw new AccessDeniedException("You can only update your own tickets");
        }

        if (request.title() != null && !request.title().isBlank()) {
            ticket.setTitle(request.title());
        }
        if (request.description() != null && !request.description().isBlank()) {
            ticket.setDescription(request.description());
        }
        if (request.category() != null && !request.category().isBlank()) {
            ticket.setCategory(request.category());
        }

        if (request.priority() != null && request.priority() != ticket.getPriority()) {
            String oldPriority = ticket.getPriority().toJson();
            lifecycle.applyPriority(ticket, request.priority());
            auditService.log(ticket, actor, AuditService.PRIORITY_CHANGED, oldPriority, request.priority().toJson());
        }

        applyAssignment(actor, ticket, request);

        if (request.status() != null) {
            TicketStatus previous = lifecycle.applyStatus(ticket, request.status());
            if (previous != request.status()) {
                auditService.log(ticket, actor, AuditService.STATUS_CHANGED, previous.toJson(), request.status().toJson());
                eventPublisher.publishEvent(TicketNotificationEvent.statusChanged(ticket, previous, actor));
                log.info("Ticket {} status {} -> {} by {}", ticket.getTicketNumber(),
                        previous.toJson(), request.status().toJson(), actor.getUsername());
            }
        }

        lifecycle.touch(ticket);
        return toResponse(ticketRepository.save(ticket));
    }

    @Transactional
    public void delete(UUID ticketId) {
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> ResourceNotFoundException.of("Ticket"));

        List<String> storedFiles = ticket.getAttachments().stream().map(Attachment::getFilename).toList();
        ticketRepository.delete(ticket);
        deleteFilesOn(TransactionSynchronization.STATUS_COMMITTED, storedFiles);
        log.info("Ticket {} deleted", ticket.getTicketNumber());
    }

    @Transactional(readOnly = true)
    public TicketStats stats(User viewer) {
        TicketFilter scope = scope(viewer, TicketFilter.none());
        Specification<Ticket> base = TicketSpecifications.matching(scope);

        return new TicketStats(
                ticketRepository.count(base),
                countWithStatus(base, TicketStatus.OPEN),
                countWithStatus(base, TicketStatus.IN_PROGRESS),
                countWithStatus(base, TicketStatus.ON_HOLD),
                countWithStatus(base, TicketStatus.RESOLVED),
                countWithStatus(base, TicketStatus.CLOSED),
                ticketRepository.count(base.and(TicketSpecifications.slaBreachedAt(lifecycle.now()))));
    }

    @Transactional
    public CommentResponse addComment(User author, UUID ticketId, CommentRequest request) {
        Ticket ticket = findVisible(author, ticketId);

        boolean internal = Boolean.TRUE.equals(request.isInternal());
        if (internal && !author.getRole().isStaff()) {
            throw new AccessDeniedException("Only IT staff can add internal comments");
        }

        Comment comment = new Comment();
        comment.setTicket(ticket);
        comment.setUser(author);
        comment.setContent(request.content());
        comment.setInternal(internal);
        comment = commentRepository.save(comment);

        lifecycle.touch(ticket);
        auditService.log(ticket, author, AuditService.COMMENT_ADDED, null, internal ? "internal" : "public");

        if (!internal) {
            eventPublisher.publishEvent(TicketNotificationEvent.commentAdded(ticket, author, request.content()));
        }
        return CommentResponse.from(comment);
    }

    @Transactional
    public List<AttachmentResponse> addAttachments(User uploader, UUID ticketId, List<MultipartFile> files) {
        Ticket ticket = findVisible(uploader, ticketId);
        List<MultipartFile> uploads = nonEmpty(files);
        if (uploads.isEmpty()) {
            throw new BadRequestException("No files uploaded");
        }
        uploads.forEach(fileStorage::validate);

        List<Attachment> stored = storeAttachments(ticket, uploader, uploads);
        lifecycle.touch(ticket);
        return stored.stream().map(AttachmentResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public List<AuditLogResponse> auditLogs(User viewer, UUID ticketId) {
        findVisible(viewer, ticketId);
        return auditService.history(ticketId);
    }

    @Transactional(readOnly = true)
    public AttachmentDownload download(User viewer, UUID attachmentId) {
        Attachment attachment = attachmentRepository.findById(attachmentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Attachment"));
        checkVisible(viewer, attachment.getTicket());

        Resource resource = fileStorage.load(attachment.getFilename())
                .orElseThrow(() -> new ResourceNotFoundException("File not found on server"));
        return new AttachmentDownload(attachment, resource);
    }

    public TicketResponse toResponse(Ticket ticket) {
        return TicketResponse.from(ticket, lifecycle.slaProgress(ticket));
    }

    private List<Attachment> storeAttachments(Ticket ticket, User uploader, List<MultipartFile> uploads) {
        List<Attachment> stored = new ArrayList<>();
        List<String> written = new ArrayList<>();
        for (MultipartFile file : uploads) {
            String storedName = fileStorage.store(file);
            written.add(storedName);

            Attachment attachment = new Attachment();
            attachment.setTicket(ticket);
            attachment.setFilename(storedName);
            attachment.setOriginalName(file.getOriginalFilename() != null ? file.getOriginalFilename() : storedName);
            attachment.setMimeType(file.getContentType());
            attachment.setSize(file.getSize());
            attachment.setUploadedBy(uploader);
            attachment = attachmentRepository.save(attachment);
            ticket.getAttachments().add(attachment);
            stored.add(attachment);

            auditService.log(ticket, uploader, AuditService.ATTACHMENT_ADDED, null, attachment.getOriginalName());
        }
        // arquivos gravados não devem sobrar se a transação voltar
        deleteFilesOn(TransactionSynchronization.STATUS_ROLLED_BACK, written);
        return stored;
    }

    private void applyAssignment(User actor, Ticket ticket, UpdateTicketRequest request) {
        User current = ticket.getAssignedTo();
        if (Boolean.TRUE.equals(request.unassign())) {
            if (current != null) {
                ticket.setAssignedTo(null);
                auditService.log(ticket, actor, AuditService.ASSIGNED, current.getName(), null);
            }
            return;
        }
        if (request.assignedToId() == null) {
            return;
        }
        if (current != null && current.getId().equals(request.assignedToId())) {
            return;
        }
        User assignee = findAssignee(request.assignedToId());
        ticket.setAssignedTo(assignee);
        auditService.log(ticket, actor, AuditService.ASSIGNED, current != null ? current.getName() : null, assignee.getName());
    }

    private void deleteFilesOn(int completionStatus, List<String> storedNames) {
        if (storedNames.isEmpty() || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == completionStatus) {
                    storedNames.forEach(fileStorage::delete);
                }
            }
        });
    }

    private long countWithStatus(Specification<Ticket> base, TicketStatus status) {
        return ticketRepository.count(base.and(TicketSpecifications.hasStatus(status)));
    }

    private User findAssignee(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new BadRequestException("Assigned user not found"));
    }

    private Ticket findVisible(User viewer, UUID ticketId) {
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> ResourceNotFoundException.of("Ticket"));
        checkVisible(viewer, ticket);
        return ticket;
    }

    // EMPLOYEE só enxerga os chamados que abriu
    private void checkVisible(User viewer, Ticket ticket) {
        if (!viewer.getRole().seesAllTickets() && !isCreator(viewer, ticket)) {
            throw new AccessDeniedException("Access denied");
        }
    }

    private TicketFilter scope(User viewer, TicketFilter filter) {
        TicketFilter base = filter != null ? filter : TicketFilter.none();
        return viewer.getRole().seesAllTickets() ? base : base.withCreatedBy(viewer.getId());
    }

    private static boolean isCreator(User user, Ticket ticket) {
        return Objects.equals(ticket.getCreatedBy().getId(), user.getId());
    }

    private static List<MultipartFile> nonEmpty(List<MultipartFile> files) {
        if (files == null) {
            return List.of();
        }
        return files.stream().filter(f -> f != null && !f.isEmpty()).toList();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
