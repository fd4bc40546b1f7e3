package com.eyelevel.bordereaux.exception.apiclient;

import java.io.Serial;

/**
 * HTTP 503. The remote service could not be reached or refused the connection.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5473001928855137452L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
