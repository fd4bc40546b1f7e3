package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 502. An upstream provider behind the language-model gateway failed.
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 4510928733627106618L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
