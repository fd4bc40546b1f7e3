package com.eyelevel.bordereaux.model;

import com.eyelevel.bordereaux.exception.InvalidStatusTransitionException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link BordereauxFile}. This enum is the only authority on which moves are legal; callers go
 * through {@link #transitionTo(FileStatus)} before writing a new status.
 *
 * <pre>
 * RECEIVED -> MATCHING -> MAPPING -> VALIDATING -> PERSISTING -> PROCESSED | PARTIALLY_PROCESSED
 *                      -> SUGGESTING -> NEEDS_TEMPLATE
 * any non-terminal state -> FAILED
 * any terminal state -> RECEIVED (explicit reprocess only)
 * </pre>
 */
public enum FileStatus {
    /**
     * Stored and registered, waiting for the next batch run to claim it.
     */
    RECEIVED,
    /**
     * Claimed by a batch run; headers are being scored against the template catalog.
     */
    MATCHING,
    /**
     * A template matched and raw rows are being converted into canonical rows.
     */
    MAPPING,
    /**
     * Canonical rows are being checked against the rule set.
     */
    VALIDATING,
    /**
     * Valid rows, validation errors and counters are being written.
     */
    PERSISTING,
    /**
     * No template matched; a mapping proposal is being generated.
     */
    SUGGESTING,
    /**
     * Every row was valid and persisted.
     */
    PROCESSED,
    /**
     * Some rows were persisted, others failed validation.
     */
    PARTIALLY_PROCESSED,
    /**
     * A mapping proposal is waiting for human review.
     */
    NEEDS_TEMPLATE,
    /**
     * The run stopped on an unrecoverable error, or no row passed validation.
     */
    FAILED;

    public boolean isTerminal() {
        return this == PROCESSED || this == PARTIALLY_PROCESSED || this == NEEDS_TEMPLATE || this == FAILED;
    }

    /**
     * States a file only occupies while a run is actively working on it.
     */
    public boolean isInProgress() {
        return this != RECEIVED && !isTerminal();
    }

    public static Set<FileStatus> inProgressStatuses() {
        return EnumSet.of(MATCHING, MAPPING, VALIDATING, PERSISTING, SUGGESTING);
    }

    public boolean canTransitionTo(final FileStatus target) {
        return target != null && successors().contains(target);
    }

    /**
     * Validates a move and returns the target.
     *
     * @throws InvalidStatusTransitionException if the state machine does not define the move
     */
    public FileStatus transitionTo(final FileStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(this, target);
        }
        return target;
    }

    private Set<FileStatus> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(MATCHING, FAILED);
            case MATCHING -> EnumSet.of(MAPPING, SUGGESTING, FAILED);
            case MAPPING -> EnumSet.of(VALIDATING, FAILED);
            case VALIDATING -> EnumSet.of(PERSISTING, FAILED);
            case PERSISTING -> EnumSet.of(PROCESSED, PARTIALLY_PROCESSED, FAILED);
            case SUGGESTING -> EnumSet.of(NEEDS_TEMPLATE, FAILED);
            case PROCESSED, PARTIALLY_PROCESSED, NEEDS_TEMPLATE, FAILED -> EnumSet.of(RECEIVED);
        };
    }
}
