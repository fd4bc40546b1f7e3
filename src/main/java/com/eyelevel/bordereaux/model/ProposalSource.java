package com.eyelevel.bordereaux.model;

/**
 * Which strategy produced a {@link MappingProposal}.
 */
public enum ProposalSource {
    AI,
    HEURISTIC
}
