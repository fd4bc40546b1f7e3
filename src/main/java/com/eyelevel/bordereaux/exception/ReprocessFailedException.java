package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * A forced reprocess was refused because the file is still being worked on, or its status changed while the
 * reset was being written.
 */
public class ReprocessFailedException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = 3390514172866021457L;

    public ReprocessFailedException(String message) {
        super(message);
    }
}
