package com.guno.salesintel.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Category a cached payload is stored under. The TTL is a store-side hint; readers apply
 * their own maximum age on top of it.
 */
@Getter
@RequiredArgsConstructor
public enum CacheType {

    SERP_ORGANIC_RAW("SerpAPI Organic Raw Data", 24),
    SERP_NEWS_RAW("SerpAPI News Raw Data", 24),
    SERP_JOBS_RAW("SerpAPI Jobs Raw Data", 24),
    SERP_LINKEDIN_RAW("SerpAPI LinkedIn Raw Data", 48),
    SERP_YOUTUBE_RAW("SerpAPI YouTube Raw Data", 72),
    BRIGHTDATA_COMPANY_ENRICHMENT("BrightData Company Enrichment", 168),
    SNOV_CONTACTS_RAW("Snov.io Contacts Raw Data", 24),
    APOLLO_CONTACT_ENRICHMENT("Apollo Contact Enrichment", 24),
    ZOOMINFO_CONTACT_ENRICHMENT("ZoomInfo Contact Enrichment", 72),
    CLEARBIT_COMPANY_ENRICHMENT("Clearbit Company Enrichment", 168),
    HUNTER_EMAIL_ENRICHMENT("Hunter Email Enrichment", 72),
    COMPANY_DATABASE_ENRICHMENT("Company Database Enrichment", 168),
    VENDOR_CONTEXT_ENRICHMENT("Vendor Context Enrichment", 168),
    UNKNOWN("Unknown", 24);

    private final String description;
    private final int defaultTtlHours;
}
