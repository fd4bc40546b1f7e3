package com.eyelevel.bordereaux.model;

/**
 * Human review state of a {@link MappingProposal}.
 */
public enum ReviewStatus {
    /**
     * Created by the suggestion generator, not yet looked at.
     */
    PENDING,
    /**
     * Accepted; a new template was created from it.
     */
    APPROVED,
    /**
     * Discarded by a reviewer.
     */
    REJECTED
}
