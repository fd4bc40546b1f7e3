package com.eyelevel.bordereaux.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Raw successful response of an outbound call. The body stays as bytes; callers parse it.
 */
@Builder
@Getter
public class ApiResponse {

    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType acceptType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
