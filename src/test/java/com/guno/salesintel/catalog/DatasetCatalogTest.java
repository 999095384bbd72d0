package com.guno.salesintel.catalog;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Slf4j
class DatasetCatalogTest {

    private final DatasetCatalog catalog = new DatasetCatalog();

    @Test
    void shouldDescribeDecisionMakers() {
        log.info("Testing decision_makers catalog entry");

        DatasetRequirement requirement = catalog.requirementsFor(DatasetType.DECISION_MAKERS);

        assertThat(requirement.isRequired()).isTrue();
        assertThat(requirement.getQualityThreshold()).isEqualTo(0.85);
        assertThat(requirement.getCollectionPriority()).isEqualTo(CollectionPriority.HIGH);
        assertThat(requirement.getFreshnessRequirement()).isEqualTo(FreshnessRequirement.DAILY);
        assertThat(requirement.getSources()).extracting(SourceOption::getSource)
                .containsExactly(SourceType.SNOV_CONTACTS, SourceType.APOLLO_CONTACTS, SourceType.SERP_LINKEDIN);

        // cheapest per unit of quality falls back first
        assertThat(requirement.getSources()).extracting(SourceOption::getFallbackPriority)
                .containsExactly(2, 3, 1);

        CostOptimization optimization = requirement.getCostOptimization();
        assertThat(optimization.getMaxCostPerDataset()).isEqualTo(0.25);
        assertThat(optimization.getFallbackStrategy()).isEqualTo(FallbackStrategy.NEXT_PRIORITY);
        assertThat(optimization.getPreferredTier()).isEqualTo(CostTier.TIER_3);
    }

    @Test
    void shouldDeriveFallbackStrategyFromPriority() {
        assertThat(catalog.requirementsFor(DatasetType.PRICING_MODEL).getCostOptimization().getFallbackStrategy())
                .isEqualTo(FallbackStrategy.SKIP);
        assertThat(catalog.requirementsFor(DatasetType.EMPLOYEE_COUNT).getCostOptimization().getFallbackStrategy())
                .isEqualTo(FallbackStrategy.CHEAPEST);
        assertThat(catalog.requirementsFor(DatasetType.EMPLOYEE_COUNT).getCostOptimization().getMaxCostPerDataset())
                .isEqualTo(0.15);
    }

    @Test
    void shouldReturnUnknownEntryForMissingDataset() {
        DatasetRequirement requirement = catalog.requirementsFor(null);

        assertThat(requirement.isRequired()).isFalse();
        assertThat(requirement.getSources()).isEmpty();
        assertThat(requirement.primarySource()).isEmpty();
    }

    @Test
    void shouldCoverEveryDatasetWithOrderedSources() {
        for (DatasetType dataset : DatasetType.values()) {
            DatasetRequirement requirement = catalog.requirementsFor(dataset);
            assertThat(requirement.getDataset()).isEqualTo(dataset);
            List<SourceOption> sources = requirement.getSources();
            if (requirement.isRequired()) {
                assertThat(sources).as("sources of required dataset %s", dataset).isNotEmpty();
            }
            for (int i = 1; i < sources.size(); i++) {
                assertThat(sources.get(i).getPriority())
                        .as("priority order of %s", dataset)
                        .isGreaterThan(sources.get(i - 1).getPriority());
            }
            assertThat(requirement.getQualityThreshold()).isBetween(0.0, 1.0);
        }
    }

    @Test
    void shouldScoreDatasetQuality() {
        long twelveHours = 12 * 3_600_000L;

        DatasetQuality quality = catalog.datasetQuality(DatasetType.DECISION_MAKERS, SourceType.SNOV_CONTACTS,
                twelveHours, 1.0);

        assertThat(quality.getFreshness()).isCloseTo(0.5, within(1e-9));
        assertThat(quality.getReliability()).isEqualTo(0.90);
        assertThat(quality.getOverall()).isCloseTo(0.82, within(1e-9));
    }

    @Test
    void shouldFloorFreshnessAndRejectUnlistedSource() {
        DatasetQuality stale = catalog.datasetQuality(DatasetType.DECISION_MAKERS, SourceType.SNOV_CONTACTS,
                72 * 3_600_000L, 0.5);
        assertThat(stale.getFreshness()).isZero();
        assertThat(stale.getOverall()).isCloseTo(0.5 * 0.4 + 0.9 * 0.3, within(1e-9));

        DatasetQuality none = catalog.datasetQuality(DatasetType.DECISION_MAKERS, SourceType.SERP_YOUTUBE, 0, 1.0);
        assertThat(none.getOverall()).isZero();
    }

    @Test
    void shouldFindRedundancyRulesInContext() {
        assertThat(catalog.redundancyFor(SourceType.BRIGHTDATA, ConsumerType.PROFILE, List.of(SourceType.SERP_ORGANIC)))
                .isPresent();
        assertThat(catalog.redundancyFor(SourceType.BRIGHTDATA, ConsumerType.CUSTOMER_INTELLIGENCE,
                List.of(SourceType.SERP_ORGANIC))).isEmpty();
        assertThat(catalog.redundancyFor(SourceType.BRIGHTDATA, ConsumerType.PROFILE, List.of())).isEmpty();
        assertThat(catalog.redundancyFor(SourceType.APOLLO_CONTACTS, ConsumerType.CUSTOMER_INTELLIGENCE,
                List.of(SourceType.SNOV_CONTACTS))).get()
                .extracting(RedundancyRule::getReason).asString().contains("Snov");
    }
}
