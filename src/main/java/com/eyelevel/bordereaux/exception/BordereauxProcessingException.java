package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * Base exception for file-level failures in the bordereaux pipeline. A file whose run ends with one of these
 * is moved to {@code FAILED} and the message is recorded on the file.
 */
public class BordereauxProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public BordereauxProcessingException(String message) {
        super(message);
    }

    public BordereauxProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
