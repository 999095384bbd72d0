package com.guno.salesintel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.cache.CacheStore;
import com.guno.salesintel.cache.CacheType;
import com.guno.salesintel.catalog.ConsumerType;
import com.guno.salesintel.config.OrchestrationProperties;
import com.guno.salesintel.core.OrchestrationCore;
import com.guno.salesintel.engine.DataCollectionEngine;
import com.guno.salesintel.engine.MultiSourceData;
import com.guno.salesintel.planner.CollectionPlanner;
import com.guno.salesintel.planner.DataCollectionPlan;
import com.guno.salesintel.planner.VendorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Vendor context kept in the raw JSON cache for {@code vendorContextTtlHours}; on a miss it is
 * rebuilt from a {@code vendor_context} collection run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CachingVendorContextResolver implements VendorContextResolver {

    static final String KEY_PREFIX = "vendor_context_";

    private final CacheStore cacheStore;
    private final OrchestrationCore core;
    private final OrchestrationProperties properties;
    private final CollectionPlanner planner;
    private final DataCollectionEngine engine;
    private final VendorContextExtractor extractor;
    private final ObjectMapper objectMapper;

    @Override
    public VendorContext resolve(String vendorCompany) {
        String cacheKey = KEY_PREFIX + OrchestrationCore.normalizeCompanyName(vendorCompany);

        try {
            VendorContext cached = readCached(cacheKey);
            if (cached != null) {
                log.debug("Vendor context cache hit for '{}'", vendorCompany);
                return cached;
            }

            DataCollectionPlan plan = planner.createCollectionPlan(vendorCompany, ConsumerType.VENDOR_CONTEXT);
            MultiSourceData vendorData = engine.executeParallelCollection(plan);
            VendorContext context = extractor.extract(vendorCompany, vendorData, core.now());

            cacheStore.setRawJson(cacheKey, objectMapper.valueToTree(context), CacheType.VENDOR_CONTEXT_ENRICHMENT);
            log.info("Vendor context built for '{}' - industry: {}, products: {}, competitors: {}",
                    vendorCompany, context.getIndustry(), context.getProducts().size(), context.getCompetitors().size());
            return context;

        } catch (Exception e) {
            log.warn("Failed to get vendor context for '{}' - using minimal context: {}", vendorCompany, e.getMessage());
            return VendorContext.minimal(vendorCompany, core.now());
        }
    }

    private VendorContext readCached(String cacheKey) {
        try {
            JsonNode json = cacheStore.getRawJson(cacheKey);
            if (json == null || !json.hasNonNull("companyName") || !json.hasNonNull("lastUpdated")) {
                return null;
            }
            VendorContext context = objectMapper.treeToValue(json, VendorContext.class);
            long age = core.now() - context.getLastUpdated();
            if (age >= properties.getVendorContextTtlHours() * 3_600_000L) {
                log.debug("Vendor context under {} is stale ({}ms old)", cacheKey, age);
                return null;
            }
            return context;
        } catch (Exception e) {
            log.warn("Vendor context cache read failed for {}: {}", cacheKey, e.getMessage());
            return null;
        }
    }
}
