package com.guno.salesintel.exception;

import com.guno.salesintel.catalog.ConsumerType;
import lombok.Getter;

/**
 * Estimated cost of a collection is above its budget. Raised before any paid call.
 */
@Getter
public class CostLimitExceededException extends OrchestrationException {

    public static final String CODE = "COST_LIMIT_EXCEEDED";

    private final double estimatedCost;
    private final double maxCost;

    public CostLimitExceededException(double estimatedCost, double maxCost) {
        this(estimatedCost, maxCost, null);
    }

    public CostLimitExceededException(double estimatedCost, double maxCost, ConsumerType consumer) {
        super(CODE, String.format("Estimated cost $%.2f exceeds limit $%.2f", estimatedCost, maxCost),
                null, consumer, null);
        this.estimatedCost = estimatedCost;
        this.maxCost = maxCost;
    }
}
