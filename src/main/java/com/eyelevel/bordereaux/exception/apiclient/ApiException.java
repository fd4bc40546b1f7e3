package com.eyelevel.bordereaux.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base type for errors that carry an HTTP status code.
 *
 * <p>Used in both directions: outbound calls made through
 * {@link com.eyelevel.bordereaux.common.apiclient.ApiClient} map remote status codes onto subclasses, and the
 * REST layer throws subclasses that the global exception handler turns into the matching response status.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
