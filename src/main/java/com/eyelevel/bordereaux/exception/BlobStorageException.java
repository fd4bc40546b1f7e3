package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * The blob store could not write or return content. A missing blob during a run fails that file.
 */
public class BlobStorageException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = 1950823561743210277L;

    public BlobStorageException(String message) {
        super(message);
    }

    public BlobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
