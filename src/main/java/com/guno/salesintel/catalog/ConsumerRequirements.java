package com.guno.salesintel.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.guno.salesintel.catalog.DatasetType.*;

/**
 * Which datasets each consumer type needs. The research consumer resolves its list per research area.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsumerRequirements {

    private static final Map<ConsumerType, List<DatasetType>> CONSUMER_DATASETS = new EnumMap<>(ConsumerType.class);
    private static final Map<ResearchArea, List<DatasetType>> RESEARCH_DATASETS = new EnumMap<>(ResearchArea.class);

    static {
        CONSUMER_DATASETS.put(ConsumerType.PROFILE, List.of(
                COMPANY_NAME, COMPANY_DOMAIN, INDUSTRY, EMPLOYEE_COUNT, COMPANY_DESCRIPTION));
        CONSUMER_DATASETS.put(ConsumerType.VENDOR_CONTEXT, List.of(
                COMPANY_NAME, COMPANY_DOMAIN, INDUSTRY, EMPLOYEE_COUNT, COMPANY_OVERVIEW,
                COMPANY_PRODUCTS, VALUE_PROPOSITIONS, TARGET_MARKETS, COMPETITIVE_LANDSCAPE,
                POSITIONING_STRATEGY, PRICING_MODEL));
        CONSUMER_DATASETS.put(ConsumerType.CUSTOMER_INTELLIGENCE, List.of(
                COMPANY_NAME, COMPANY_DOMAIN, INDUSTRY, EMPLOYEE_COUNT, COMPANY_OVERVIEW,
                DECISION_MAKERS, TECHNOLOGY_STACK, BUSINESS_CHALLENGES, RECENT_ACTIVITIES,
                BUYING_SIGNALS, GROWTH_SIGNALS, COMPETITIVE_USAGE, BUDGET_INDICATORS));
        CONSUMER_DATASETS.put(ConsumerType.TEST, List.of(COMPANY_NAME, COMPANY_DOMAIN));

        RESEARCH_DATASETS.put(ResearchArea.COMPANY_OVERVIEW, List.of(
                COMPANY_NAME, COMPANY_DOMAIN, INDUSTRY, COMPANY_OVERVIEW, EMPLOYEE_COUNT));
        RESEARCH_DATASETS.put(ResearchArea.DECISION_MAKERS, List.of(DECISION_MAKERS, COMPANY_DOMAIN));
        RESEARCH_DATASETS.put(ResearchArea.TECH_STACK, List.of(TECHNOLOGY_STACK, INTEGRATION_NEEDS, DIGITAL_FOOTPRINT));
        RESEARCH_DATASETS.put(ResearchArea.BUSINESS_CHALLENGES, List.of(
                BUSINESS_CHALLENGES, RECENT_ACTIVITIES, BUDGET_INDICATORS));
        RESEARCH_DATASETS.put(ResearchArea.COMPETITIVE_POSITIONING_VALUE_PROPS, List.of(
                COMPETITIVE_LANDSCAPE, VALUE_PROPOSITIONS, POSITIONING_STRATEGY));
    }

    private final DatasetCatalog catalog;

    /**
     * Datasets for a consumer. For {@link ConsumerType#RESEARCH} this is the company overview area.
     */
    public List<DatasetType> datasetsFor(ConsumerType consumerType) {
        if (consumerType == ConsumerType.RESEARCH) {
            return datasetsFor(ResearchArea.COMPANY_OVERVIEW);
        }
        List<DatasetType> datasets = consumerType != null ? CONSUMER_DATASETS.get(consumerType) : null;
        if (datasets == null) {
            log.warn("No dataset requirements registered for consumer '{}'", consumerType);
            return Collections.emptyList();
        }
        return datasets;
    }

    public List<DatasetType> datasetsFor(ResearchArea area) {
        return RESEARCH_DATASETS.getOrDefault(area, RESEARCH_DATASETS.get(ResearchArea.COMPANY_OVERVIEW));
    }

    /**
     * Primary (priority 1) source of every dataset, in dataset order, without duplicates.
     * Datasets missing from the catalog contribute nothing.
     */
    public List<SourceType> primarySourcesFor(List<DatasetType> datasets) {
        Set<SourceType> sources = new LinkedHashSet<>();
        for (DatasetType dataset : datasets) {
            catalog.requirementsFor(dataset).primarySource()
                    .ifPresent(option -> sources.add(option.getSource()));
        }
        return new ArrayList<>(sources);
    }

    /**
     * Default candidate sources for a research area.
     */
    public List<SourceType> researchSources(ResearchArea area) {
        return primarySourcesFor(datasetsFor(area));
    }
}
