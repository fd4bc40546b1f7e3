package com.eyelevel.bordereaux.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A received bordereau. {@link #status} is the single source of truth for pipeline progress and is only
 * changed through conditional updates that respect {@link FileStatus#transitionTo(FileStatus)}.
 */
@Entity
@Table(name = "bordereaux_file", indexes = {
        @Index(name = "idx_bordereaux_file_status", columnList = "status"),
        @Index(name = "idx_bordereaux_file_sender", columnList = "sender")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BordereauxFile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false, unique = true, length = 64)
    private String contentHash;

    private Long fileSize;

    private String sender;

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileType fileType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileStatus status;

    private String templateId;

    @Builder.Default
    @Column(nullable = false)
    private Integer totalRows = 0;

    @Builder.Default
    @Column(nullable = false)
    private Integer validRows = 0;

    @Builder.Default
    @Column(nullable = false)
    private Integer errorRows = 0;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private LocalDateTime processedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
