package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 409. The target is not in a state that allows the requested change, e.g. reviewing an already reviewed proposal.
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7716223940571385092L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
