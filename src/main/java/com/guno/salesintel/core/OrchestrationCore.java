package com.guno.salesintel.core;

import com.guno.salesintel.cache.CacheEntry;
import com.guno.salesintel.cache.CacheType;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.config.OrchestrationProperties;
import com.guno.salesintel.config.OrchestrationProperties.SourceProfile;
import com.guno.salesintel.exception.CostLimitExceededException;
import com.guno.salesintel.exception.OrchestrationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Collection;
import java.util.Locale;

/**
 * Shared lookups and checks used by the planner and the collection engine. Stateless apart
 * from its configuration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrchestrationCore {

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private final OrchestrationProperties properties;
    private final Clock clock;

    // ================================
    // CACHE KEYS & EXPIRY
    // ================================

    /**
     * {@code "{source_id}_{normalized}"} where the company name is lowercased with every
     * character outside [a-z0-9] removed, so "Acme, Inc." and "acme inc" share a slot.
     */
    public String cacheKey(SourceType source, String companyName) {
        return source.getId() + "_" + normalizeCompanyName(companyName);
    }

    /**
     * @throws OrchestrationException {@code INVALID_REQUEST} when nothing is left after normalizing,
     *         since every such name would share one cache slot
     */
    public static String normalizeCompanyName(String companyName) {
        String normalized = companyName == null ? "" : companyName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (normalized.isEmpty()) {
            throw new OrchestrationException("INVALID_REQUEST",
                    "Company name '" + companyName + "' has no letters or digits");
        }
        return normalized;
    }

    /**
     * Missing entries and entries without a timestamp count as expired. An entry exactly
     * {@code maxAgeHours} old is expired.
     */
    public boolean isExpired(CacheEntry entry, int maxAgeHours) {
        if (entry == null || entry.getTimestamp() == null) {
            return true;
        }
        return ageMs(entry) >= maxAgeHours * MILLIS_PER_HOUR;
    }

    public long ageMs(CacheEntry entry) {
        if (entry == null || entry.getTimestamp() == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, clock.millis() - entry.getTimestamp());
    }

    public long now() {
        return clock.millis();
    }

    // ================================
    // SOURCE TABLE LOOKUPS
    // ================================

    public double costOf(SourceType source) {
        SourceProfile profile = profileOf(source);
        return profile != null ? profile.getCost() : properties.getFallbackCost();
    }

    public long durationOf(SourceType source) {
        SourceProfile profile = profileOf(source);
        return profile != null ? profile.getDurationMs() : properties.getFallbackDurationMs();
    }

    /**
     * 0-100.
     */
    public int reliabilityOf(SourceType source) {
        SourceProfile profile = profileOf(source);
        return profile != null ? profile.getReliability() : properties.getFallbackReliability();
    }

    public CacheType cacheTypeOf(SourceType source) {
        SourceProfile profile = profileOf(source);
        return profile != null && profile.getCacheType() != null ? profile.getCacheType() : CacheType.UNKNOWN;
    }

    /**
     * Higher is collected first; sources missing from the table sort last.
     */
    public int priorityOf(SourceType source) {
        SourceProfile profile = profileOf(source);
        return profile != null ? profile.getPriority() : 0;
    }

    private SourceProfile profileOf(SourceType source) {
        if (source == null) {
            return null;
        }
        SourceProfile profile = properties.getSources().get(source);
        if (profile == null) {
            log.debug("Source {} missing from source table - using fallback constants", source);
        }
        return profile;
    }

    // ================================
    // COST & QUALITY
    // ================================

    /**
     * @throws CostLimitExceededException when {@code estimatedCost > maxCost}
     */
    public void validateCostLimits(double estimatedCost, double maxCost) {
        if (roundCost(estimatedCost) > roundCost(maxCost)) {
            log.warn("Cost limit exceeded - estimated: ${}, max: ${}", estimatedCost, maxCost);
            throw new CostLimitExceededException(estimatedCost, maxCost);
        }
    }

    public double totalCost(Collection<SourceType> sources) {
        double total = 0;
        for (SourceType source : sources) {
            total += costOf(source);
        }
        return roundCost(total);
    }

    /**
     * Reliability of the primary source, +5 when more than one source contributed, capped at 100.
     */
    public int dataQualityScore(int contributingSources, SourceType primarySource) {
        if (contributingSources <= 0 || primarySource == null) {
            return 0;
        }
        int score = reliabilityOf(primarySource);
        if (contributingSources > 1) {
            score += 5;
        }
        return Math.min(100, score);
    }

    /**
     * Rounds to 4 decimals so that sums of per-call costs compare exactly.
     */
    public static double roundCost(double cost) {
        return BigDecimal.valueOf(cost).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
