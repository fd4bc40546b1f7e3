package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 500. Unexpected failure on the remote side or inside this service.
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 391091864299701366L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
