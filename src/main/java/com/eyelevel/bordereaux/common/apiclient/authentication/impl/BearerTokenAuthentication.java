package com.eyelevel.bordereaux.common.apiclient.authentication.impl;

import com.eyelevel.bordereaux.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Sends {@code Authorization: Bearer <token>}. A blank token adds nothing.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying bearer token authentication.");
            return;
        }
        if (token == null || token.isBlank()) {
            log.debug("No bearer token configured; request is sent unauthenticated.");
            return;
        }
        authorization.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[token=****]";
    }
}
