package com.itdesk.backend.service;

import com.itdesk.backend.domain.ActivityLog;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.dto.ActivityLogDTOs.ActivityEventRequest;
import com.itdesk.backend.dto.ActivityLogDTOs.ActivityLogPage;
import com.itdesk.backend.repository.ActivityLogRepository;
import com.itdesk.backend.repository.ActivityLogSpecifications;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Log geral de atividade (chamadas de API, login/logout e eventos do front).
 * Gravação best-effort: erros vão para o log da aplicação e são ignorados.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityLogService {

    public static final String API_CALL = "api_call";
    public static final String LOGIN = "login";
    public static final String LOGOUT = "logout";

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 500;

    static final String[] EXPORT_HEADER = {
        "createdAt", "userId", "action", "resource", "resourceId", "method", "endpoint",
        "success", "errorMessage", "duration", "ipAddress", "userAgent", "details"
    };

    private final ActivityLogRepository activityLogRepository;

    public void record(ActivityLog entry) {
        try {
            activityLogRepository.save(entry);
        } catch (RuntimeException e) {
            log.error("Failed to write activity log '{}' for {}: {}", entry.getAction(), entry.getEndpoint(), e.getMessage());
        }
    }

    public void recordLogin(UUID userId, HttpServletRequest request, boolean success, String errorMessage) {
        ActivityLog entry = fromRequest(request, LOGIN);
        entry.setUserId(userId);
        entry.setResource("auth");
        entry.setSuccess(success);
        entry.setErrorMessage(errorMessage);
        record(entry);
    }

    public void recordLogout(UUID userId, HttpServletRequest request) {
        ActivityLog entry = fromRequest(request, LOGOUT);
        entry.setUserId(userId);
        entry.setResource("auth");
        record(entry);
    }

    public ActivityLog recordClientEvent(User user, ActivityEventRequest event, HttpServletRequest request) {
        ActivityLog entry = fromRequest(request, event.action());
        entry.setUserId(user.getId());
        entry.setResource(event.resource());
        entry.setResourceId(event.resourceId());
        entry.setDetails(event.details());
        entry.setSuccess(event.success() == null || event.success());
        entry.setErrorMessage(event.errorMessage());
        record(entry);
        return entry;
    }

    @Transactional(readOnly = true)
    public ActivityLogPage search(UUID userId, String action, String resource, LocalDateTime start, LocalDateTime end,
                                  Integer page, Integer limit) {
        int pageNumber = page == null || page < 1 ? 1 : page;
        int pageSize = limit == null || limit < 1 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);

        Page<ActivityLog> result = activityLogRepository.findAll(
                ActivityLogSpecifications.matching(userId, action, resource, start, end),
                PageRequest.of(pageNumber - 1, pageSize, newestFirst()));
        return new ActivityLogPage(result.getContent(), result.getTotalElements(), pageNumber, pageSize);
    }

    @Transactional(readOnly = true)
    public ByteArrayInputStream exportCsv(UUID userId, String action, String resource,
                                          LocalDateTime start, LocalDateTime end) {
        Specification<ActivityLog> spec = ActivityLogSpecifications.matching(userId, action, resource, start, end);
        List<ActivityLog> logs = activityLogRepository.findAll(spec, newestFirst());

        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                .setHeader(EXPORT_HEADER)
                .build();
        return CsvSupport.write(format, printer -> {
            for (ActivityLog entry : logs) {
                printer.printRecord(
                        entry.getCreatedAt(),
                        entry.getUserId(),
                        entry.getAction(),
                        entry.getResource(),
                        entry.getResourceId(),
                        entry.getMethod(),
                        entry.getEndpoint(),
                        entry.isSuccess(),
                        entry.getErrorMessage(),
                        entry.getDuration(),
                        entry.getIpAddress(),
                        entry.getUserAgent(),
                        entry.getDetails());
            }
        });
    }

    public ActivityLog fromRequest(HttpServletRequest request, String action) {
        ActivityLog entry = new ActivityLog();
        entry.setAction(action);
        entry.setMethod(request.getMethod());
        entry.setEndpoint(request.getRequestURI());
        entry.setUserAgent(truncate(request.getHeader("User-Agent"), 512));
        entry.setIpAddress(clientIp(request));
        if (request.getSession(false) != null) {
            entry.setSessionId(request.getSession(false).getId());
        }
        return entry;
    }

    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private static Sort newestFirst() {
        return Sort.by(Sort.Direction.DESC, "createdAt");
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
