package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 429. The language-model endpoint is rate limiting this client.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -831557702248377415L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
