package com.guno.salesintel.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Named categories of company information. A dataset is satisfied by one or more sources.
 */
@Getter
@RequiredArgsConstructor
public enum DatasetType {

    // Vendor context: who the user's own company is
    COMPANY_PRODUCTS("company_products"),
    VALUE_PROPOSITIONS("value_propositions"),
    TARGET_MARKETS("target_markets"),
    COMPETITIVE_LANDSCAPE("competitive_landscape"),
    POSITIONING_STRATEGY("positioning_strategy"),
    CONTENT_THEMES("content_themes"),
    PRICING_MODEL("pricing_model"),
    SALES_METHODOLOGY("sales_methodology"),
    COMPANY_CULTURE("company_culture"),
    MARKET_PRESENCE("market_presence"),

    // Customer intelligence: the prospect
    COMPANY_OVERVIEW("company_overview"),
    DECISION_MAKERS("decision_makers"),
    TECHNOLOGY_STACK("tech_stack"),
    BUSINESS_CHALLENGES("business_challenges"),
    RECENT_ACTIVITIES("recent_activities"),
    BUDGET_INDICATORS("budget_indicators"),
    BUYING_SIGNALS("buying_signals"),
    COMPETITIVE_USAGE("competitive_usage"),
    DIGITAL_FOOTPRINT("digital_footprint"),
    GROWTH_SIGNALS("growth_signals"),
    COMPLIANCE_REQUIREMENTS("compliance_requirements"),
    INTEGRATION_NEEDS("integration_needs"),

    // Shared basics
    COMPANY_NAME("company_name"),
    COMPANY_DOMAIN("company_domain"),
    INDUSTRY("industry"),
    EMPLOYEE_COUNT("employee_count"),
    COMPANY_DESCRIPTION("company_description"),

    // Added from vendor context during context-aware planning
    INDUSTRY_ANALYSIS("industry_analysis"),
    PRODUCT_REVIEWS("product_reviews"),
    GEOGRAPHIC_DISTRIBUTION("geographic_distribution");

    @JsonValue
    private final String id;

    @Override
    public String toString() {
        return id;
    }
}
