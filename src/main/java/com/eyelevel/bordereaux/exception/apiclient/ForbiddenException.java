package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 403. The remote service accepted the credentials but refused the operation.
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3127448203918574561L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
