package com.guno.salesintel.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.support.MutableClock;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@Slf4j
class InMemoryCacheStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
    private final InMemoryCacheStore store = new InMemoryCacheStore(objectMapper, clock);

    @Test
    void shouldRoundTripCacheEntry() {
        ObjectNode data = objectMapper.createObjectNode().put("title", "Acme raises Series B");
        CacheEntry entry = CacheEntry.builder()
                .data(data)
                .timestamp(clock.millis())
                .source(SourceType.SERP_NEWS)
                .companyName("Acme")
                .build();

        store.set("serp_news_acme", entry, CacheType.SERP_NEWS_RAW);
        CacheEntry loaded = store.get("serp_news_acme");

        assertThat(loaded).isNotNull();
        assertThat(loaded.getSource()).isEqualTo(SourceType.SERP_NEWS);
        assertThat(loaded.getCompanyName()).isEqualTo("Acme");
        assertThat(loaded.getTimestamp()).isEqualTo(clock.millis());
        assertThat(loaded.getData().path("title").asText()).isEqualTo("Acme raises Series B");
        assertThat(loaded.hasData()).isTrue();
    }

    @Test
    void shouldEvictAfterCacheTypeTtl() {
        store.setRawJson("serp_news_acme", objectMapper.createObjectNode().put("k", "v"), CacheType.SERP_NEWS_RAW);

        clock.advance(Duration.ofHours(23));
        assertThat(store.getRawJson("serp_news_acme")).isNotNull();

        clock.advance(Duration.ofHours(1));
        assertThat(store.getRawJson("serp_news_acme")).isNull();
        assertThat(store.size()).isZero();
    }

    @Test
    void shouldKeepLongLivedTypesLonger() {
        store.setRawJson("brightdata_acme", objectMapper.createObjectNode(), CacheType.BRIGHTDATA_COMPANY_ENRICHMENT);

        clock.advance(Duration.ofDays(6));

        assertThat(store.getRawJson("brightdata_acme")).isNotNull();
    }

    @Test
    void shouldReportWhetherDeleteRemovedSomething() {
        store.setRawJson("serp_organic_acme", objectMapper.createObjectNode(), CacheType.SERP_ORGANIC_RAW);

        assertThat(store.delete("serp_organic_acme")).isTrue();
        assertThat(store.delete("serp_organic_acme")).isFalse();
        assertThat(store.get("serp_organic_acme")).isNull();
    }

    @Test
    void shouldIsolateStoredValuesFromCallers() {
        ObjectNode original = objectMapper.createObjectNode().put("name", "Acme");
        store.setRawJson("key", original, CacheType.UNKNOWN);

        original.put("name", "Changed");
        JsonNode first = store.getRawJson("key");
        ((ObjectNode) first).put("name", "Mutated");

        assertThat(store.getRawJson("key").path("name").asText()).isEqualTo("Acme");
    }

    @Test
    void shouldDropUnreadableEntries() {
        store.setRawJson("broken", objectMapper.createObjectNode().put("timestamp", "not-a-number"), CacheType.UNKNOWN);

        assertThat(store.get("broken")).isNull();
        assertThat(store.healthCheck()).isTrue();
    }
}
