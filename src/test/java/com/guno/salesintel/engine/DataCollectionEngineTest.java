package com.guno.salesintel.engine;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.guno.salesintel.cache.CacheEntry;
import com.guno.salesintel.cache.CacheStore;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.core.OrchestrationCore;
import com.guno.salesintel.exception.CostLimitExceededException;
import com.guno.salesintel.planner.DataCollectionPlan;
import com.guno.salesintel.support.OrchestrationTestContext;
import com.guno.salesintel.support.StubCollector;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.guno.salesintel.catalog.SourceType.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Slf4j
class DataCollectionEngineTest {

    private OrchestrationTestContext ctx;

    @AfterEach
    void tearDown() {
        if (ctx != null) {
            ctx.close();
        }
    }

    @Test
    void shouldServeEverythingFromFreshCache() {
        log.info("Testing collection fully served from cache");
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        StubCollector news = StubCollector.returningData(SERP_NEWS);
        ctx = new OrchestrationTestContext(organic, news);

        seed(SERP_ORGANIC, "Acme", Duration.ofMinutes(10));
        seed(SERP_NEWS, "Acme", Duration.ofMinutes(30));

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC, SERP_NEWS));

        assertThat(organic.getCalls()).isZero();
        assertThat(news.getCalls()).isZero();
        assertThat(data.getCacheHits()).isEqualTo(2);
        assertThat(data.getNewApiCalls()).isZero();
        assertThat(data.getTotalNewCost()).isZero();
        assertThat(data.getTotalCacheSavings()).isEqualTo(0.10);
        assertThat(data.statusOf(SERP_ORGANIC)).isEqualTo(SourceStatus.CACHED);
        assertThat(data.getSummary().getCacheHitRate()).isEqualTo(1.0);
        assertThat(data.getDataQuality().getFreshness()).isLessThan(1.0).isGreaterThan(0.0);
    }

    @Test
    void shouldSkipCostCheckWhenNothingToFetch() {
        ctx = new OrchestrationTestContext(StubCollector.returningData(SERP_ORGANIC));
        seed(SERP_ORGANIC, "Acme", Duration.ofMinutes(1));

        DataCollectionPlan overBudget = plan("Acme", ConsumerType.TEST, SERP_ORGANIC).toBuilder()
                .estimatedCost(5.0)
                .maxCost(1.0)
                .build();

        assertThatCode(() -> ctx.engine.executeParallelCollection(overBudget)).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectPlanOverBudgetBeforeCallingApis() {
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        ctx = new OrchestrationTestContext(organic);

        DataCollectionPlan overBudget = plan("Acme", ConsumerType.TEST, SERP_ORGANIC).toBuilder()
                .estimatedCost(2.0)
                .maxCost(1.0)
                .build();

        assertThatThrownBy(() -> ctx.engine.executeParallelCollection(overBudget))
                .isInstanceOf(CostLimitExceededException.class);
        assertThat(organic.getCalls()).isZero();
    }

    @Test
    void shouldIsolateFailingSource() {
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        StubCollector news = StubCollector.failing(SERP_NEWS);
        StubCollector jobs = StubCollector.returningData(SERP_JOBS);
        ctx = new OrchestrationTestContext(organic, news, jobs);

        MultiSourceData data = ctx.engine.executeParallelCollection(
                plan("Acme", ConsumerType.CUSTOMER_INTELLIGENCE, SERP_ORGANIC, SERP_NEWS, SERP_JOBS));

        assertThat(data.getSummary().getSuccessfulTasks()).isEqualTo(2);
        assertThat(data.getSummary().getFailedTasks()).isEqualTo(1);
        assertThat(news.getCalls()).isEqualTo(3);
        assertThat(ctx.sleeps).containsExactly(100L, 200L);
        assertThat(data.has(SERP_NEWS)).isFalse();
        assertThat(data.statusOf(SERP_NEWS)).isEqualTo(SourceStatus.FAILED);
        assertThat(data.getResults()).filteredOn(r -> r.getSource() == SERP_NEWS)
                .singleElement().extracting(CollectionResult::getError).asString().contains("simulated failure");
        assertThat(data.getTotalNewCost()).isEqualTo(0.10);
        assertThat(data.getNewApiCalls()).isEqualTo(2);
        assertThat(data.getCostsAttribution()).containsEntry(ConsumerType.CUSTOMER_INTELLIGENCE, 0.10);
        assertThat(data.getDataQuality().getCompleteness()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(data.getDataQuality().getFreshness()).isEqualTo(1.0);
    }

    @Test
    void shouldRecoverAfterTransientFailure() {
        StubCollector organic = StubCollector.failingTimes(SERP_ORGANIC, 1);
        ctx = new OrchestrationTestContext(organic);

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC));

        assertThat(organic.getCalls()).isEqualTo(2);
        assertThat(data.statusOf(SERP_ORGANIC)).isEqualTo(SourceStatus.COLLECTED);
        assertThat(data.getOrganic().path("company").asText()).isEqualTo("Acme");
    }

    @Test
    void shouldWriteApiResultsBackToCache() {
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        ctx = new OrchestrationTestContext(organic);
        DataCollectionPlan plan = plan("Acme, Inc.", ConsumerType.TEST, SERP_ORGANIC);

        ctx.engine.executeParallelCollection(plan);
        CacheEntry cached = ctx.cacheStore.get(ctx.core.cacheKey(SERP_ORGANIC, "acme inc"));

        assertThat(cached).isNotNull();
        assertThat(cached.getTimestamp()).isEqualTo(OrchestrationTestContext.NOW.toEpochMilli());
        assertThat(cached.getSource()).isEqualTo(SERP_ORGANIC);
        assertThat(cached.getCompanyName()).isEqualTo("Acme, Inc.");

        MultiSourceData second = ctx.engine.executeParallelCollection(plan);
        assertThat(organic.getCalls()).isEqualTo(1);
        assertThat(second.getCacheHits()).isEqualTo(1);
    }

    @Test
    void shouldTreatCacheFailuresAsMisses() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("cache unreachable"));
        doThrow(new IllegalStateException("cache unreachable"))
                .when(broken).setRawJson(anyString(), any(), any());

        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        StubCollector news = StubCollector.returningData(SERP_NEWS);
        ctx = new OrchestrationTestContext(broken, p -> { }, organic, news);

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC, SERP_NEWS));

        assertThat(data.getCacheHits()).isZero();
        assertThat(data.getNewApiCalls()).isEqualTo(2);
        assertThat(data.statusOf(SERP_NEWS)).isEqualTo(SourceStatus.COLLECTED);
    }

    @Test
    void shouldFailUnregisteredSourceWithoutRetry() {
        ctx = new OrchestrationTestContext(StubCollector.returningData(SERP_ORGANIC));

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC, HUNTER));

        assertThat(data.statusOf(HUNTER)).isEqualTo(SourceStatus.FAILED);
        assertThat(data.statusOf(SERP_ORGANIC)).isEqualTo(SourceStatus.COLLECTED);
        assertThat(ctx.sleeps).isEmpty();
    }

    @Test
    void shouldRefetchEntriesOlderThanConsumerTtl() {
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        ctx = new OrchestrationTestContext(organic);
        seed(SERP_ORGANIC, "Acme", Duration.ofHours(2));

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC));

        assertThat(organic.getCalls()).isEqualTo(1);
        assertThat(data.statusOf(SERP_ORGANIC)).isEqualTo(SourceStatus.COLLECTED);

        // a 24h consumer accepts the same entry age
        seed(SERP_NEWS, "Acme", Duration.ofHours(2));
        StubCollector news = StubCollector.returningData(SERP_NEWS);
        OrchestrationTestContext ciCtx = new OrchestrationTestContext(ctx.cacheStore, p -> { }, news);
        try {
            MultiSourceData ci = ciCtx.engine.executeParallelCollection(
                    plan("Acme", ConsumerType.CUSTOMER_INTELLIGENCE, SERP_NEWS));
            assertThat(news.getCalls()).isZero();
            assertThat(ci.getCacheHits()).isEqualTo(1);
        } finally {
            ciCtx.close();
        }
    }

    @Test
    void shouldReportEmptyResponsesWithoutCachingButChargeForThem() {
        StubCollector organic = StubCollector.returning(SERP_ORGANIC, JsonNodeFactory.instance.objectNode());
        StubCollector news = StubCollector.returning(SERP_NEWS, null);
        ctx = new OrchestrationTestContext(organic, news);

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC, SERP_NEWS));

        assertThat(data.statusOf(SERP_ORGANIC)).isEqualTo(SourceStatus.EMPTY);
        assertThat(data.statusOf(SERP_NEWS)).isEqualTo(SourceStatus.EMPTY);
        assertThat(data.getNewApiCalls()).isZero();
        assertThat(ctx.cacheStore.getRawJson(ctx.core.cacheKey(SERP_ORGANIC, "Acme"))).isNull();

        double billed = OrchestrationCore.roundCost(ctx.core.costOf(SERP_ORGANIC) + ctx.core.costOf(SERP_NEWS));
        assertThat(billed).isPositive();
        assertThat(data.getTotalNewCost()).isEqualTo(billed);
        assertThat(data.getSummary().getTotalCost()).isEqualTo(billed);
        assertThat(data.getCostsAttribution().get(ConsumerType.TEST)).isEqualTo(billed);
    }

    @Test
    void shouldTreatHandBuiltPlanWithoutBudgetAsUnbounded() {
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        ctx = new OrchestrationTestContext(organic);

        DataCollectionPlan plan = DataCollectionPlan.builder()
                .companyName("Acme")
                .requester(ConsumerType.TEST)
                .toCollect(List.of(SERP_ORGANIC))
                .estimatedCost(ctx.core.costOf(SERP_ORGANIC))
                .build();

        MultiSourceData data = ctx.engine.executeParallelCollection(plan);

        assertThat(plan.getMaxCost()).isEqualTo(Double.MAX_VALUE);
        assertThat(organic.getCalls()).isEqualTo(1);
        assertThat(data.statusOf(SERP_ORGANIC)).isEqualTo(SourceStatus.COLLECTED);
    }

    @Test
    void shouldPaceApiBatches() {
        ctx = new OrchestrationTestContext(p -> p.setMaxParallelSources(2),
                StubCollector.returningData(SERP_ORGANIC), StubCollector.returningData(SERP_NEWS),
                StubCollector.returningData(SERP_JOBS), StubCollector.returningData(SERP_LINKEDIN),
                StubCollector.returningData(SERP_YOUTUBE));

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.CUSTOMER_INTELLIGENCE,
                SERP_ORGANIC, SERP_NEWS, SERP_JOBS, SERP_LINKEDIN, SERP_YOUTUBE));

        assertThat(data.getSummary().getSuccessfulTasks()).isEqualTo(5);
        assertThat(ctx.sleeps).containsExactly(500L, 500L);
    }

    @Test
    void shouldBypassCacheWhenDisabled() {
        StubCollector organic = StubCollector.returningData(SERP_ORGANIC);
        ctx = new OrchestrationTestContext(p -> p.setCacheEnabled(false), organic);
        seed(SERP_ORGANIC, "Acme", Duration.ofMinutes(1));

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST, SERP_ORGANIC));

        assertThat(organic.getCalls()).isEqualTo(1);
        assertThat(data.getCacheHits()).isZero();
    }

    @Test
    void shouldHandleEmptyPlan() {
        ctx = new OrchestrationTestContext();

        MultiSourceData data = ctx.engine.executeParallelCollection(plan("Acme", ConsumerType.TEST));

        assertThat(data.getSummary().getTotalTasks()).isZero();
        assertThat(data.getDataQuality().getCompleteness()).isZero();
        assertThat(data.getTotalNewCost()).isZero();
    }

    private DataCollectionPlan plan(String company, ConsumerType consumer, SourceType... sources) {
        return ctx.planner.createCollectionPlan(company, consumer, 10.0, List.of(sources)).toBuilder()
                .toCollect(List.of(sources))
                .build();
    }

    private void seed(SourceType source, String company, Duration age) {
        long timestamp = ctx.clock.millis() - age.toMillis();
        CacheEntry entry = CacheEntry.builder()
                .data(StubCollector.payload(source, company))
                .timestamp(timestamp)
                .source(source)
                .companyName(company)
                .build();
        ctx.cacheStore.set(ctx.core.cacheKey(source, company), entry, ctx.core.cacheTypeOf(source));
    }
}
