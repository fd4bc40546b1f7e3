package com.eyelevel.bordereaux.model;

import com.eyelevel.bordereaux.model.converter.StringListJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A candidate column mapping for a file that matched no template, kept for human review. Approving one creates
 * a new {@link Template}; nothing is ever activated automatically.
 */
@Entity
@Table(name = "mapping_proposal", indexes = @Index(name = "idx_mapping_proposal_file", columnList = "file_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingProposal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false)
    private BordereauxFile file;

    /**
     * One entry per canonical field, in schema order.
     */
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mapping_proposal_field", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "field_order")
    private List<ProposalFieldMapping> fieldMappings = new ArrayList<>();

    @Column(nullable = false)
    private double overallConfidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProposalSource source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewStatus reviewStatus;

    @Builder.Default
    @Convert(converter = StringListJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> fileHeaders = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String reasoning;

    private String sourceFilename;

    private String sender;

    @Column(columnDefinition = "TEXT")
    private String subject;

    private String approvedTemplateId;

    private LocalDateTime reviewedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    /**
     * Raw header to canonical field for every mapped entry, in schema order.
     */
    public Map<String, String> mappedColumns() {
        final Map<String, String> mapped = new LinkedHashMap<>();
        for (ProposalFieldMapping mapping : fieldMappings) {
            if (mapping.getRawHeader() != null) {
                mapped.put(mapping.getRawHeader(), mapping.getCanonicalField());
            }
        }
        return mapped;
    }
}
