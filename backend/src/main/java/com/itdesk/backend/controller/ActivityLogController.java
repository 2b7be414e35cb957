package com.itdesk.backend.controller;

import com.itdesk.backend.domain.ActivityLog;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.dto.ActivityLogDTOs.ActivityEventRequest;
import com.itdesk.backend.dto.ActivityLogDTOs.ActivityLogPage;
import com.itdesk.backend.service.ActivityLogService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/activity-logs")
@RequiredArgsConstructor
public class ActivityLogController {

    private final ActivityLogService activityLogService;

    // Eventos do front (qualquer usuário autenticado)
    @PostMapping
    public ResponseEntity<ActivityLog> record(@AuthenticationPrincipal User user,
                                              @Valid @RequestBody ActivityEventRequest event,
                                              HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(activityLogService.recordClientEvent(user, event, request));
    }

    @GetMapping
    public ActivityLogPage search(@RequestParam(required = false) UUID userId,
                                  @RequestParam(required = false) String action,
                                  @RequestParam(required = false) String resource,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                                  @RequestParam(required = false) Integer page,
                                  @RequestParam(required = false) Integer limit) {
        return activityLogService.search(userId, action, resource, startOf(startDate), endOf(endDate), page, limit);
    }

    @GetMapping("/export")
    public ResponseEntity<InputStreamResource> export(
            @RequestParam(required = false) UUID userId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String resource,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return UserController.csv("activity-logs.csv",
                activityLogService.exportCsv(userId, action, resource, startOf(startDate), endOf(endDate)));
    }

    private static LocalDateTime startOf(LocalDate date) {
        return date != null ? date.atStartOfDay() : null;
    }

    // data final inclusiva
    private static LocalDateTime endOf(LocalDate date) {
        return date != null ? date.plusDays(1).atStartOfDay() : null;
    }
}
