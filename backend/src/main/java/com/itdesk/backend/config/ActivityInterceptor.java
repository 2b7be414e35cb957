package com.itdesk.backend.config;

import com.itdesk.backend.core.security.SecurityUtils;
import com.itdesk.backend.domain.ActivityLog;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.service.ActivityLogService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registra uma entrada "api_call" por requisição em /api, com duração e
 * resultado. POST em /api/activity-logs fica de fora porque já é o próprio log.
 */
@Component
@RequiredArgsConstructor
public class ActivityInterceptor implements HandlerInterceptor {

    static final String START_ATTRIBUTE = ActivityInterceptor.class.getName() + ".start";

    private static final Pattern UUID_SEGMENT = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final ActivityLogService activityLogService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        if ("POST".equals(request.getMethod()) && request.getRequestURI().startsWith("/api/activity-logs")) {
            return;
        }

        ActivityLog entry = activityLogService.fromRequest(request, ActivityLogService.API_CALL);
        entry.setUserId(SecurityUtils.findCurrentUser().map(User::getId).orElse(null));
        entry.setResource(resourceOf(request.getRequestURI()));
        entry.setResourceId(firstUuid(request.getRequestURI()));
        entry.setSuccess(ex == null && response.getStatus() < 400);
        if (ex != null) {
            entry.setErrorMessage(ex.getMessage());
        } else if (response.getStatus() >= 400) {
            entry.setErrorMessage("HTTP " + response.getStatus());
        }

        Object start = request.getAttribute(START_ATTRIBUTE);
        if (start instanceof Long) {
            entry.setDuration(System.currentTimeMillis() - (Long) start);
        }
        activityLogService.record(entry);
    }

    // /api/tickets/123/comments -> tickets
    static String resourceOf(String uri) {
        String path = uri.startsWith("/api/") ? uri.substring(5) : uri;
        int slash = path.indexOf('/');
        String segment = slash >= 0 ? path.substring(0, slash) : path;
        return segment.isEmpty() ? null : segment;
    }

    static String firstUuid(String uri) {
        Matcher matcher = UUID_SEGMENT.matcher(uri);
        if (!matcher.find()) {
            return null;
        }
        try {
            return UUID.fromString(matcher.group()).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
