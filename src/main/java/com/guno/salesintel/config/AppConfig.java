package com.guno.salesintel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.cache.CacheStore;
import com.guno.salesintel.cache.InMemoryCacheStore;
import com.guno.salesintel.core.BoundedBatchExecutor;
import com.guno.salesintel.core.RetryExecutor;
import com.guno.salesintel.core.Sleeper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure beans shared by the orchestration layer.
 */
@Configuration
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CollectorProperties collectorProperties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(collectorProperties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(collectorProperties.getReadTimeoutMs()))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService collectionExecutor(OrchestrationProperties properties) {
        // Cache reads fan out over every planned source, API calls over one batch
        return Executors.newFixedThreadPool(Math.max(2, properties.getMaxParallelSources() * 2));
    }

    @Bean
    public RetryExecutor retryExecutor(Sleeper sleeper) {
        return new RetryExecutor(sleeper);
    }

    @Bean
    public BoundedBatchExecutor boundedBatchExecutor(ExecutorService collectionExecutor, Sleeper sleeper) {
        return new BoundedBatchExecutor(collectionExecutor, sleeper);
    }

    @Bean
    @ConditionalOnMissingBean(CacheStore.class)
    public CacheStore cacheStore(ObjectMapper objectMapper, Clock clock) {
        return new InMemoryCacheStore(objectMapper, clock);
    }
}
