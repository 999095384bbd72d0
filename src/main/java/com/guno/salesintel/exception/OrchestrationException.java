package com.guno.salesintel.exception;

import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.SourceType;
import lombok.Getter;

/**
 * Base of every failure raised by the orchestration layer.
 */
@Getter
public class OrchestrationException extends RuntimeException {

    private final String code;
    private final SourceType source;
    private final ConsumerType consumer;

    public OrchestrationException(String code, String message) {
        this(code, message, null, null, null);
    }

    public OrchestrationException(String code, String message, SourceType source, ConsumerType consumer, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.source = source;
        this.consumer = consumer;
    }
}
