package com.eyelevel.bordereaux.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate raw header for one canonical field inside a {@link MappingProposal}.
 */
@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class ProposalFieldMapping {

    @Column(name = "canonical_field", nullable = false)
    private String canonicalField;

    /**
     * Null when no header qualified.
     */
    @Column(name = "raw_header")
    private String rawHeader;

    @Column(name = "confidence", nullable = false)
    private double confidence;
}
