package com.guno.salesintel.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Third-party data providers the orchestrator can query.
 */
@Getter
@RequiredArgsConstructor
public enum SourceType {

    SERP_ORGANIC("serp_organic"),
    SERP_NEWS("serp_news"),
    SERP_JOBS("serp_jobs"),
    SERP_LINKEDIN("serp_linkedin"),
    SERP_YOUTUBE("serp_youtube"),
    BRIGHTDATA("brightdata"),
    SNOV_CONTACTS("snov_contacts"),
    APOLLO_CONTACTS("apollo_contacts"),
    ZOOMINFO("zoominfo"),
    CLEARBIT("clearbit"),
    HUNTER("hunter"),
    COMPANY_DB("company_db");

    @JsonValue
    private final String id;

    /**
     * Resolve a wire id ("serp_news") or constant name ("SERP_NEWS").
     */
    public static Optional<SourceType> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.id.equalsIgnoreCase(normalized) || s.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static SourceType fromJson(String value) {
        return fromId(value).orElse(null);
    }

    @Override
    public String toString() {
        return id;
    }
}
