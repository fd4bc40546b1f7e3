package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 400. Raised for malformed outbound requests and for invalid input reaching the API layer.
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2298416634517725341L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
