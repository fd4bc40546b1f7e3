package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * The stored bytes could not be turned into a header row and data rows: unsupported format, corrupt content,
 * or no header row at all.
 */
public class DecodeException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = -2761180933412256507L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
