package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 401. The language-model endpoint rejected the configured API key.
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6125560716372919382L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
