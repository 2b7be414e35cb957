package com.itdesk.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.UUID;

@Data
@Entity
@Table(name = "activity_logs", indexes = {
    @Index(name = "idx_activity_logs_created_at", columnList = "created_at"),
    @Index(name = "idx_activity_logs_user_id", columnList = "user_id")
})
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
public class ActivityLog extends BaseEntity {

    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "session_id")
    private String sessionId;

    @Column(nullable = false)
    private String action;

    private String resource;

    @Column(name = "resource_id")
    private String resourceId;

    private String method;

    @Column(length = 1024)
    private String endpoint;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "ip_address")
    private String ipAddress;

    @Column(columnDefinition = "TEXT")
    private String details;

    private boolean success = true;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /** Duração da requisição em milissegundos. */
    private Long duration;
}
