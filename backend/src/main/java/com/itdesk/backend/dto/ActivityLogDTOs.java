package com.itdesk.backend.dto;

import com.itdesk.backend.domain.ActivityLog;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public class ActivityLogDTOs {

    /** Eventos reportados pelo front (page_view, click, form_submit, search...). */
    public record ActivityEventRequest(@NotBlank String action, String resource, String resourceId, String details,
                                       Boolean success, String errorMessage) {}

    public record ActivityLogPage(List<ActivityLog> logs, long total, int page, int limit) {}
}
