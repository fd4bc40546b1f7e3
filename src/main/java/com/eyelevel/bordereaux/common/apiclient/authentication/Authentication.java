package com.eyelevel.bordereaux.common.apiclient.authentication;

import java.util.Map;

/**
 * Applies credentials to the headers of an outbound request.
 */
public interface Authentication {

    /**
     * @param authorization mutable request headers; implementations add their entries
     */
    void applyAuthentication(Map<String, String> authorization);
}
