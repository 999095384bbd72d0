package com.guno.salesintel.exception;

import com.guno.salesintel.catalog.SourceType;

/**
 * A source could not be queried: no collector registered, transport failure or unreadable payload.
 */
public class SourceUnavailableException extends OrchestrationException {

    public static final String CODE = "SOURCE_UNAVAILABLE";

    public SourceUnavailableException(SourceType source, String message) {
        this(source, message, null);
    }

    public SourceUnavailableException(SourceType source, String message, Throwable cause) {
        super(CODE, message, source, null, cause);
    }
}
