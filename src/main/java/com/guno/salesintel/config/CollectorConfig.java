package com.guno.salesintel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.collector.HttpSourceCollector;
import com.guno.salesintel.collector.SourceCollector;
import com.guno.salesintel.collector.SourceCollectorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the collector registry from {@link SourceCollector} beans plus one
 * {@link HttpSourceCollector} per enabled endpoint. Beans take precedence over endpoints.
 */
@Configuration
@Slf4j
public class CollectorConfig {

    @Bean
    public SourceCollectorRegistry sourceCollectorRegistry(ObjectProvider<SourceCollector> collectorBeans,
                                                           CollectorProperties collectorProperties,
                                                           RestTemplate restTemplate,
                                                           ObjectMapper objectMapper) {
        List<SourceCollector> collectors = new ArrayList<>();
        collectorBeans.orderedStream().forEach(collectors::add);

        collectorProperties.getEndpoints().forEach((source, settings) -> {
            if (collectorProperties.isEnabled(source)) {
                collectors.add(new HttpSourceCollector(source, settings, restTemplate, objectMapper));
            } else {
                log.debug("HTTP collector for {} disabled", source);
            }
        });

        log.info("Enabled HTTP endpoints: {}", collectorProperties.getEnabledSources());
        return new SourceCollectorRegistry(collectors);
    }
}
