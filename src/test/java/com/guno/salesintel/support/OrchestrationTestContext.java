package com.guno.salesintel.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.cache.CacheStore;
import com.guno.salesintel.cache.InMemoryCacheStore;
import com.guno.salesintel.catalog.ConsumerRequirements;
import com.guno.salesintel.catalog.DatasetCatalog;
import com.guno.salesintel.collector.SourceCollector;
import com.guno.salesintel.collector.SourceCollectorRegistry;
import com.guno.salesintel.config.OrchestrationProperties;
import com.guno.salesintel.core.BoundedBatchExecutor;
import com.guno.salesintel.core.OrchestrationCore;
import com.guno.salesintel.core.RetryExecutor;
import com.guno.salesintel.core.Sleeper;
import com.guno.salesintel.engine.DataCollectionEngine;
import com.guno.salesintel.planner.CollectionPlanner;
import com.guno.salesintel.service.CachingVendorContextResolver;
import com.guno.salesintel.service.DataSourceOrchestrator;
import com.guno.salesintel.service.VendorContextExtractor;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Hand-wired orchestration graph for unit tests: no Spring context, no real sleeps,
 * a controllable clock and an in-memory cache unless another store is given.
 */
public class OrchestrationTestContext implements AutoCloseable {

    public static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final MutableClock clock = new MutableClock(NOW);
    public final OrchestrationProperties properties = new OrchestrationProperties();
    public final List<Long> sleeps = new CopyOnWriteArrayList<>();
    public final Sleeper sleeper = millis -> sleeps.add(millis);

    public final OrchestrationCore core;
    public final DatasetCatalog catalog;
    public final ConsumerRequirements consumerRequirements;
    public final CollectionPlanner planner;
    public final CacheStore cacheStore;
    public final SourceCollectorRegistry registry;
    public final DataCollectionEngine engine;
    public final CachingVendorContextResolver vendorContextResolver;
    public final DataSourceOrchestrator orchestrator;

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    public OrchestrationTestContext(SourceCollector... collectors) {
        this(null, p -> { }, collectors);
    }

    public OrchestrationTestContext(Consumer<OrchestrationProperties> customizer, SourceCollector... collectors) {
        this(null, customizer, collectors);
    }

    public OrchestrationTestContext(CacheStore store, Consumer<OrchestrationProperties> customizer,
                                    SourceCollector... collectors) {
        properties.setRetryBaseDelayMs(100);
        properties.setBatchPacingMs(500);
        customizer.accept(properties);

        core = new OrchestrationCore(properties, clock);
        catalog = new DatasetCatalog();
        consumerRequirements = new ConsumerRequirements(catalog);
        planner = new CollectionPlanner(core, properties, catalog, consumerRequirements);
        cacheStore = store != null ? store : new InMemoryCacheStore(objectMapper, clock);
        registry = new SourceCollectorRegistry(Arrays.asList(collectors));
        engine = new DataCollectionEngine(core, properties, cacheStore, registry,
                new RetryExecutor(sleeper), new BoundedBatchExecutor(executor, sleeper), objectMapper);
        vendorContextResolver = new CachingVendorContextResolver(cacheStore, core, properties, planner, engine,
                new VendorContextExtractor(), objectMapper);
        orchestrator = new DataSourceOrchestrator(planner, engine, core, properties, catalog, cacheStore,
                registry, vendorContextResolver);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
