package com.itdesk.backend.domain;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Entity
@Table(name = "attachments")
@Data
@EqualsAndHashCode(callSuper = true, onlyExplicitlyIncluded = true)
@ToString(exclude = {"ticket", "uploadedBy"})
public class Attachment extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ticket_id", nullable = false)
    private Ticket ticket;

    /** Nome gerado no disco (uuid + extensão). */
    @Column(nullable = false, updatable = false)
    private String filename;

    @Column(name = "original_name", nullable = false, updatable = false)
    private String originalName;

    @Column(name = "mime_type", nullable = false, updatable = false)
    private String mimeType;

    @Column(nullable = false, updatable = false)
    private long size;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "uploaded_by_id", nullable = false, updatable = false)
    private User uploadedBy;
}
