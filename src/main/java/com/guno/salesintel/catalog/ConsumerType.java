package com.guno.salesintel.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Internal requester of a collection run. Each one carries its own budget and cache defaults.
 */
@Getter
@RequiredArgsConstructor
public enum ConsumerType {

    PROFILE("profile"),
    VENDOR_CONTEXT("vendor_context"),
    CUSTOMER_INTELLIGENCE("customer_intelligence"),
    TEST("test"),
    RESEARCH("research");

    @JsonValue
    private final String id;

    @Override
    public String toString() {
        return id;
    }
}
