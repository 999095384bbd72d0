package com.guno.salesintel.config;

import com.guno.salesintel.catalog.SourceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collector Configuration - one HTTP endpoint per source, each with its own enable switch
 *
 * Usage in application.yml:
 * collectors:
 *   endpoints:
 *     serp_organic:
 *       enabled: true
 *       base-url: https://serpapi.com/search.json
 *       query-param: q
 *       api-key-param: api_key
 *       api-key: ${SERPAPI_KEY:}
 */
@Configuration
@ConfigurationProperties(prefix = "collectors")
@Data
public class CollectorProperties {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;

    private Map<SourceType, EndpointSettings> endpoints = new EnumMap<>(SourceType.class);

    @Data
    public static class EndpointSettings {
        private boolean enabled = false;
        private String baseUrl;
        private String queryParam = "q";
        private String apiKeyParam;
        private String apiKey;
        /** Extra fixed query parameters, e.g. engine=google_news. */
        private Map<String, String> params = new LinkedHashMap<>();

        public boolean hasApiKey() {
            return apiKeyParam != null && !apiKeyParam.isEmpty() && apiKey != null && !apiKey.isEmpty();
        }
    }

    // Convenience methods
    public boolean isEnabled(SourceType source) {
        EndpointSettings settings = endpoints.get(source);
        return settings != null && settings.isEnabled() && settings.getBaseUrl() != null;
    }

    public String getEnabledSources() {
        StringBuilder sb = new StringBuilder();
        endpoints.keySet().stream().filter(this::isEnabled).forEach(s -> sb.append(s).append(","));
        String result = sb.toString();
        return result.isEmpty() ? "None" : result.substring(0, result.length() - 1);
    }
}
