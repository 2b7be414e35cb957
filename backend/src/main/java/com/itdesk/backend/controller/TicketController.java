package com.itdesk.backend.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import com.itdesk.backend.dto.AuthDTOs.MessageResponse;
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
import com.itdesk.backend.repository.TicketFilter;
import com.itdesk.backend.service.TicketService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    // --- LISTA (EMPLOYEE só vê os próprios) ---
    @GetMapping
    public TicketPage list(@AuthenticationPrincipal User user,
                           @RequestParam(required = false) TicketStatus status,
                           @RequestParam(required = false) TicketPriority priority,
                           @RequestParam(required = false) String department,
                           @RequestParam(required = false) UUID assignedToId,
                           @RequestParam(required = false) UUID createdById,
                           @RequestParam(required = false) String search,
                           @RequestParam(required = false) Integer page,
                           @RequestParam(required = false) Integer limit) {
        TicketFilter filter = new TicketFilter(status, priority, department, assignedToId, createdById, search);
        return ticketService.list(user, filter, page, limit);
    }

    @GetMapping("/stats")
    public TicketStats stats(@AuthenticationPrincipal User user) {
        return ticketService.stats(user);
    }

    @GetMapping("/{id}")
    public TicketDetail get(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return ticketService.getDetail(user, id);
    }

    // --- CRIAR CHAMADO (JSON) ---
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TicketResponse> create(@AuthenticationPrincipal User user,
                                                 @Valid @RequestBody CreateTicketRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.create(user, request, List.of()));
    }

    // --- CRIAR CHAMADO COM ANEXOS (multipart: parte "ticket" em JSON + "attachments") ---
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TicketResponse> createWithAttachments(
            @AuthenticationPrincipal User user,
            @RequestPart("ticket") String ticketJson,
            @RequestPart(value = "attachments", required = false) List<MultipartFile> attachments) {
        CreateTicketRequest request = parseTicket(ticketJson);
        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.create(user, request, attachments));
    }

    @PatchMapping("/{id}")
    public TicketResponse update(@AuthenticationPrincipal User user, @PathVariable UUID id,
                                 @Valid @RequestBody UpdateTicketRequest request) {
        return ticketService.update(user, id, request);
    }

    // ADMIN apenas (SecurityConfig)
    @DeleteMapping("/{id}")
    public MessageResponse delete(@PathVariable UUID id) {
        ticketService.delete(id);
        return new MessageResponse("Ticket deleted successfully");
    }

    @PostMapping("/{id}/comments")
    public ResponseEntity<CommentResponse> addComment(@AuthenticationPrincipal User user, @PathVariable UUID id,
                                                      @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.addComment(user, id, request));
    }

    @PostMapping(value = "/{id}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<List<AttachmentResponse>> addAttachments(
            @AuthenticationPrincipal User user, @PathVariable UUID id,
            @RequestPart(value = "attachments", required = false) List<MultipartFile> attachments) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.addAttachments(user, id, attachments));
    }

    @GetMapping("/{id}/audit-logs")
    public List<AuditLogResponse> auditLogs(@AuthenticationPrincipal User user, @PathVariable UUID id) {
        return ticketService.auditLogs(user, id);
    }

    private CreateTicketRequest parseTicket(String json) {
        CreateTicketRequest request;
        try {
            request = objectMapper.readValue(json, CreateTicketRequest.class);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Invalid ticket data");
        }
        Set<ConstraintViolation<CreateTicketRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return request;
    }
}
