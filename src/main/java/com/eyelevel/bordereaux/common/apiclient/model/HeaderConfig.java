package com.eyelevel.bordereaux.common.apiclient.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Static headers sent with every request of one client. Subclasses define the header list.
 */
@Getter
@Setter
public abstract class HeaderConfig {

    private List<Header> headers;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Header {

        private String name;
        private String value;
    }
}
