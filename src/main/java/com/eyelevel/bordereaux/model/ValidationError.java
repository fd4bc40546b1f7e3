package com.eyelevel.bordereaux.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One rule violation on one row. Append-only: written once in the persisting stage and only ever removed as a
 * whole when the file is reprocessed.
 */
@Getter
@Entity
@Immutable
@Table(name = "validation_error", indexes = @Index(name = "idx_validation_error_file", columnList = "file_id"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class ValidationError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false)
    private BordereauxFile file;

    @Column(nullable = false)
    private Integer rowIndex;

    /**
     * Null for rules that concern the row as a whole.
     */
    private String fieldName;

    @Column(nullable = false)
    private String ruleName;

    @Column(nullable = false)
    private String errorCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(columnDefinition = "TEXT")
    private String fieldValue;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
