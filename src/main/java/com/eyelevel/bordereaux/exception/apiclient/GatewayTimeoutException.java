package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 504. The remote call did not complete within the configured timeout.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7071019530397087493L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
