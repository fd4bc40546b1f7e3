package com.eyelevel.bordereaux.exception;

import com.eyelevel.bordereaux.model.FileStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Raised when code asks the file state machine for a move it does not define.
 */
@Getter
public class InvalidStatusTransitionException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = 3392716047793519230L;

    private final FileStatus from;
    private final FileStatus to;

    public InvalidStatusTransitionException(FileStatus from, FileStatus to) {
        super(String.format("Invalid file status transition %s -> %s", from, to));
        this.from = from;
        this.to = to;
    }
}
