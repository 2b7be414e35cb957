package com.itdesk.backend.repository;

import com.itdesk.backend.domain.ActivityLog;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.UUID;

public final class ActivityLogSpecifications {

    private ActivityLogSpecifications() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Specification<ActivityLog> matching(UUID userId, String action, String resource,
                                                      LocalDateTime start, LocalDateTime end) {
        Specification<ActivityLog> spec = Specification.where(null);
        if (userId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("userId"), userId));
        }
        if (action != null && !action.isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("action"), action));
        }
        if (resource != null && !resource.isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("resource"), resource));
        }
        if (start != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), start));
        }
        if (end != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("createdAt"), end));
        }
        return spec;
    }
}
