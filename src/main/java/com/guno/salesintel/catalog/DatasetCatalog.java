package com.guno.salesintel.catalog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.guno.salesintel.catalog.CollectionPriority.HIGH;
import static com.guno.salesintel.catalog.CollectionPriority.LOW;
import static com.guno.salesintel.catalog.CollectionPriority.MEDIUM;
import static com.guno.salesintel.catalog.ExtractionComplexity.COMPLEX;
import static com.guno.salesintel.catalog.ExtractionComplexity.MODERATE;
import static com.guno.salesintel.catalog.ExtractionComplexity.SIMPLE;
import static com.guno.salesintel.catalog.FreshnessRequirement.DAILY;
import static com.guno.salesintel.catalog.FreshnessRequirement.MONTHLY;
import static com.guno.salesintel.catalog.FreshnessRequirement.REAL_TIME;
import static com.guno.salesintel.catalog.FreshnessRequirement.WEEKLY;
import static com.guno.salesintel.catalog.SourceType.APOLLO_CONTACTS;
import static com.guno.salesintel.catalog.SourceType.BRIGHTDATA;
import static com.guno.salesintel.catalog.SourceType.SERP_JOBS;
import static com.guno.salesintel.catalog.SourceType.SERP_LINKEDIN;
import static com.guno.salesintel.catalog.SourceType.SERP_NEWS;
import static com.guno.salesintel.catalog.SourceType.SERP_ORGANIC;
import static com.guno.salesintel.catalog.SourceType.SNOV_CONTACTS;

/**
 * Dataset requirements matrix: for every dataset, which sources can supply it, at what cost
 * and reliability, and how fresh it has to be.
 */
@Component
@Slf4j
public class DatasetCatalog {

    private static final int DEFAULT_TTL_HOURS = 24;

    private static final List<RedundancyRule> REDUNDANCY_RULES = List.of(
            RedundancyRule.builder()
                    .condition(Set.of(SERP_ORGANIC))
                    .skip(BRIGHTDATA)
                    .context(Set.of(ConsumerType.PROFILE))
                    .reason("Organic search already covers basic company info for profiles")
                    .build(),
            RedundancyRule.builder()
                    .condition(Set.of(SNOV_CONTACTS))
                    .skip(APOLLO_CONTACTS)
                    .context(Set.of(ConsumerType.CUSTOMER_INTELLIGENCE))
                    .reason("Snov already supplies decision-maker contacts")
                    .build());

    private final Map<DatasetType, DatasetRequirement> requirements;

    public DatasetCatalog() {
        this.requirements = Collections.unmodifiableMap(buildMatrix());
    }

    /**
     * Requirement for a dataset. Unknown ids return an empty, non-required entry.
     */
    public DatasetRequirement requirementsFor(DatasetType dataset) {
        DatasetRequirement requirement = dataset != null ? requirements.get(dataset) : null;
        if (requirement == null) {
            log.warn("No catalog entry for dataset '{}' - skipping", dataset);
            return DatasetRequirement.unknown(dataset);
        }
        return requirement;
    }

    /**
     * First rule that makes {@code candidate} redundant given what is already selected.
     */
    public Optional<RedundancyRule> redundancyFor(SourceType candidate, ConsumerType consumer,
                                                  Collection<SourceType> selected) {
        return REDUNDANCY_RULES.stream()
                .filter(rule -> rule.applies(candidate, consumer, selected))
                .findFirst();
    }

    /**
     * Quality of a dataset when served by {@code sourceUsed}.
     *
     * @param ageMs            age of the data in milliseconds
     * @param dataCompleteness 0-1 completeness of the payload
     */
    public DatasetQuality datasetQuality(DatasetType dataset, SourceType sourceUsed, long ageMs, double dataCompleteness) {
        Optional<SourceOption> option = requirementsFor(dataset).optionFor(sourceUsed);
        if (option.isEmpty()) {
            return DatasetQuality.none();
        }

        int ttlHours = option.get().getTypicalTtlHours() > 0 ? option.get().getTypicalTtlHours() : DEFAULT_TTL_HOURS;
        double expectedTtlMs = ttlHours * 3_600_000.0;
        double freshness = Math.max(0, 1 - (ageMs / expectedTtlMs));
        double reliability = option.get().getReliability();
        double overall = dataCompleteness * 0.4 + freshness * 0.3 + reliability * 0.3;

        return DatasetQuality.builder()
                .completeness(dataCompleteness)
                .freshness(freshness)
                .reliability(reliability)
                .overall(overall)
                .build();
    }

    private static SourceOption option(SourceType source, int priority, double cost, double reliability,
                                       FreshnessNeed freshness, ExtractionComplexity complexity, int ttlHours) {
        return SourceOption.builder()
                .source(source)
                .priority(priority)
                .cost(cost)
                .reliability(reliability)
                .freshnessNeeded(freshness)
                .extractionComplexity(complexity)
                .typicalTtlHours(ttlHours)
                .build();
    }

    private static void put(Map<DatasetType, DatasetRequirement> matrix, DatasetType dataset, boolean required,
                            double threshold, String description, CollectionPriority priority,
                            FreshnessRequirement freshness, SourceOption... options) {
        matrix.put(dataset, DatasetRequirement.of(dataset, required, threshold, description, priority, freshness,
                List.of(options)));
    }

    private static Map<DatasetType, DatasetRequirement> buildMatrix() {
        Map<DatasetType, DatasetRequirement> m = new EnumMap<>(DatasetType.class);
        FreshnessNeed hi = FreshnessNeed.HIGH;
        FreshnessNeed med = FreshnessNeed.MEDIUM;
        FreshnessNeed lo = FreshnessNeed.LOW;

        // Vendor context
        put(m, DatasetType.COMPANY_PRODUCTS, true, 0.80, "Products and services offered by the vendor company", HIGH, WEEKLY,
                option(SERP_ORGANIC, 1, 0.02, 0.85, med, MODERATE, 168),
                option(BRIGHTDATA, 2, 0.08, 0.90, lo, SIMPLE, 336));
        put(m, DatasetType.VALUE_PROPOSITIONS, true, 0.75, "Key differentiators and unique value propositions", HIGH, WEEKLY,
                option(SERP_ORGANIC, 1, 0.02, 0.80, med, COMPLEX, 168),
                option(BRIGHTDATA, 2, 0.08, 0.85, lo, MODERATE, 336));
        put(m, DatasetType.COMPETITIVE_LANDSCAPE, true, 0.80, "Direct and indirect competitors analysis", HIGH, WEEKLY,
                option(SERP_ORGANIC, 1, 0.03, 0.85, med, COMPLEX, 168),
                option(BRIGHTDATA, 2, 0.10, 0.90, lo, MODERATE, 336));
        put(m, DatasetType.POSITIONING_STRATEGY, false, 0.70, "How vendor positions against competitors", MEDIUM, WEEKLY,
                option(SERP_ORGANIC, 1, 0.02, 0.75, med, COMPLEX, 168));
        put(m, DatasetType.TARGET_MARKETS, false, 0.75, "Industries and customer segments served", MEDIUM, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.80, lo, MODERATE, 336),
                option(BRIGHTDATA, 2, 0.08, 0.85, lo, SIMPLE, 336));
        put(m, DatasetType.PRICING_MODEL, false, 0.65, "Pricing strategy and models", LOW, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.70, med, COMPLEX, 168));
        put(m, DatasetType.CONTENT_THEMES, false, 0.70, "Content themes and messaging strategies", LOW, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.75, med, COMPLEX, 168));
        put(m, DatasetType.SALES_METHODOLOGY, false, 0.65, "Sales process and methodology", LOW, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.70, lo, COMPLEX, 336));
        put(m, DatasetType.COMPANY_CULTURE, false, 0.70, "Company culture and values", LOW, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.75, lo, MODERATE, 336));
        put(m, DatasetType.MARKET_PRESENCE, false, 0.75, "Geographic and market footprint", MEDIUM, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.80, lo, MODERATE, 336),
                option(BRIGHTDATA, 2, 0.08, 0.85, lo, SIMPLE, 336));

        // Customer intelligence
        put(m, DatasetType.DECISION_MAKERS, true, 0.85, "Key decision makers and stakeholders", HIGH, DAILY,
                option(SNOV_CONTACTS, 1, 0.10, 0.90, hi, SIMPLE, 24),
                option(APOLLO_CONTACTS, 2, 0.15, 0.85, hi, SIMPLE, 24),
                option(SERP_LINKEDIN, 3, 0.03, 0.75, med, COMPLEX, 48));
        put(m, DatasetType.TECHNOLOGY_STACK, true, 0.80, "Current technology stack and preferences", HIGH, WEEKLY,
                option(BRIGHTDATA, 1, 0.08, 0.85, med, MODERATE, 168),
                option(SERP_ORGANIC, 2, 0.02, 0.70, med, COMPLEX, 168));
        put(m, DatasetType.BUSINESS_CHALLENGES, false, 0.75, "Current business challenges and pain points", HIGH, DAILY,
                option(SERP_NEWS, 1, 0.02, 0.80, hi, COMPLEX, 24),
                option(SERP_ORGANIC, 2, 0.02, 0.75, med, COMPLEX, 72));
        put(m, DatasetType.BUYING_SIGNALS, false, 0.80, "Purchase intent and buying signals", HIGH, REAL_TIME,
                option(SERP_NEWS, 1, 0.02, 0.85, hi, MODERATE, 12),
                option(SERP_JOBS, 2, 0.02, 0.80, hi, MODERATE, 24));
        put(m, DatasetType.RECENT_ACTIVITIES, true, 0.85, "Recent news, hiring, and business activities", HIGH, REAL_TIME,
                option(SERP_NEWS, 1, 0.02, 0.90, hi, SIMPLE, 12),
                option(SERP_JOBS, 2, 0.02, 0.85, hi, SIMPLE, 24));
        put(m, DatasetType.BUDGET_INDICATORS, false, 0.70, "Financial health and spending indicators", MEDIUM, WEEKLY,
                option(SERP_NEWS, 1, 0.02, 0.75, med, COMPLEX, 72),
                option(BRIGHTDATA, 2, 0.08, 0.80, lo, MODERATE, 168));
        put(m, DatasetType.COMPETITIVE_USAGE, false, 0.75, "Current vendor relationships and solutions", MEDIUM, WEEKLY,
                option(BRIGHTDATA, 1, 0.08, 0.85, med, MODERATE, 168),
                option(SERP_ORGANIC, 2, 0.02, 0.70, med, COMPLEX, 168));
        put(m, DatasetType.GROWTH_SIGNALS, false, 0.75, "Growth and expansion indicators", MEDIUM, DAILY,
                option(SERP_NEWS, 1, 0.02, 0.80, hi, MODERATE, 24),
                option(SERP_JOBS, 2, 0.02, 0.85, hi, SIMPLE, 24));
        put(m, DatasetType.DIGITAL_FOOTPRINT, false, 0.75, "Online presence and digital marketing activity", LOW, WEEKLY,
                option(SERP_ORGANIC, 1, 0.02, 0.85, med, MODERATE, 168));
        put(m, DatasetType.COMPLIANCE_REQUIREMENTS, false, 0.70, "Regulatory and compliance requirements", LOW, MONTHLY,
                option(SERP_ORGANIC, 1, 0.02, 0.75, lo, COMPLEX, 336));
        put(m, DatasetType.INTEGRATION_NEEDS, false, 0.65, "Technical integration requirements and preferences", LOW, WEEKLY,
                option(SERP_ORGANIC, 1, 0.02, 0.70, med, COMPLEX, 168));

        // Shared basics
        put(m, DatasetType.COMPANY_NAME, true, 0.95, "Official company name verification", HIGH, MONTHLY,
                option(SERP_ORGANIC, 1, 0.01, 0.95, lo, SIMPLE, 720));
        put(m, DatasetType.COMPANY_DOMAIN, true, 0.95, "Official company website domain", HIGH, MONTHLY,
                option(SERP_ORGANIC, 1, 0.01, 0.95, lo, SIMPLE, 720));
        put(m, DatasetType.INDUSTRY, true, 0.85, "Primary industry classification", HIGH, WEEKLY,
                option(SERP_ORGANIC, 1, 0.01, 0.90, lo, MODERATE, 336),
                option(BRIGHTDATA, 2, 0.05, 0.85, lo, SIMPLE, 336));
        put(m, DatasetType.EMPLOYEE_COUNT, false, 0.75, "Company size and employee count", MEDIUM, WEEKLY,
                option(BRIGHTDATA, 1, 0.05, 0.80, med, SIMPLE, 168),
                option(SERP_ORGANIC, 2, 0.01, 0.70, med, MODERATE, 168));
        put(m, DatasetType.COMPANY_OVERVIEW, true, 0.85, "Comprehensive company overview and description", HIGH, WEEKLY,
                option(SERP_ORGANIC, 1, 0.01, 0.90, med, SIMPLE, 168),
                option(BRIGHTDATA, 2, 0.05, 0.85, lo, SIMPLE, 336));
        put(m, DatasetType.COMPANY_DESCRIPTION, false, 0.80, "Basic company description", MEDIUM, MONTHLY,
                option(SERP_ORGANIC, 1, 0.01, 0.85, lo, SIMPLE, 336));

        // Context-derived
        put(m, DatasetType.INDUSTRY_ANALYSIS, false, 0.75, "Industry trends relevant to the vendor's market", MEDIUM, WEEKLY,
                option(SERP_NEWS, 1, 0.02, 0.80, med, COMPLEX, 72),
                option(SERP_ORGANIC, 2, 0.02, 0.75, med, COMPLEX, 168));
        put(m, DatasetType.PRODUCT_REVIEWS, false, 0.70, "Reviews of products the prospect uses", MEDIUM, WEEKLY,
                option(BRIGHTDATA, 1, 0.08, 0.85, med, MODERATE, 168),
                option(SERP_ORGANIC, 2, 0.02, 0.70, med, COMPLEX, 168));
        put(m, DatasetType.GEOGRAPHIC_DISTRIBUTION, false, 0.70, "Offices, regions and hiring locations", LOW, MONTHLY,
                option(SERP_JOBS, 1, 0.02, 0.80, med, MODERATE, 72),
                option(SERP_ORGANIC, 2, 0.02, 0.75, lo, MODERATE, 336));

        return m;
    }
}
