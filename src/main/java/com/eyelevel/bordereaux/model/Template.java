package com.eyelevel.bordereaux.model;

import com.eyelevel.bordereaux.model.converter.StringMapJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A known bordereau layout: ordered mapping from raw header to canonical field name. Templates are never
 * edited in place; a changed layout is a new template.
 */
@Entity
@Table(name = "bordereaux_template")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Template {

    @Id
    @Column(name = "template_id", length = 128)
    private String templateId;

    @Column(nullable = false)
    private String name;

    private String carrier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileType fileType;

    /**
     * Raw header (as written in the partner's file) to canonical field name, in mapping order.
     */
    @Builder.Default
    @Convert(converter = StringMapJsonConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private Map<String, String> columnMappings = new LinkedHashMap<>();

    @Builder.Default
    @Column(nullable = false)
    private Integer version = 1;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
