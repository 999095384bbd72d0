package com.guno.salesintel.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.config.CollectorProperties.EndpointSettings;
import com.guno.salesintel.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic JSON-over-GET collector: {@code baseUrl?{queryParam}={company}&{fixed params}&{apiKeyParam}={apiKey}}.
 * Retries are left to the engine.
 */
@Slf4j
public class HttpSourceCollector implements SourceCollector {

    private final SourceType source;
    private final EndpointSettings settings;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public HttpSourceCollector(SourceType source, EndpointSettings settings,
                               RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.source = source;
        this.settings = settings;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceType source() {
        return source;
    }

    @Override
    public JsonNode collect(String companyName) {
        URI uri = buildUri(companyName);
        log.debug("Calling {} for company '{}'", source, companyName);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, createHttpEntity(), String.class);
        } catch (RestClientException e) {
            throw new SourceUnavailableException(source, source + " call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new SourceUnavailableException(source, source + " returned HTTP " + response.getStatusCode().value());
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            log.debug("{} returned an empty body for '{}'", source, companyName);
            return null;
        }

        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new SourceUnavailableException(source, source + " returned an unreadable payload", e);
        }
    }

    /**
     * Configured and keyed where a key is needed. No request is made.
     */
    @Override
    public boolean isAvailable() {
        boolean configured = settings.isEnabled() && settings.getBaseUrl() != null && !settings.getBaseUrl().isEmpty();
        boolean keyed = settings.getApiKeyParam() == null || settings.getApiKeyParam().isEmpty() || settings.hasApiKey();
        return configured && keyed;
    }

    /**
     * Every query value goes in as a URI variable so that it is encoded as data; braces or
     * reserved characters in a company name never reach the template parser.
     */
    URI buildUri(String companyName) {
        Map<String, Object> values = new HashMap<>();
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .queryParam(settings.getQueryParam(), "{company}");
        values.put("company", companyName);

        int index = 0;
        for (Map.Entry<String, String> param : settings.getParams().entrySet()) {
            String variable = "param" + index++;
            builder.queryParam(param.getKey(), "{" + variable + "}");
            values.put(variable, param.getValue());
        }
        if (settings.hasApiKey()) {
            builder.queryParam(settings.getApiKeyParam(), "{apiKey}");
            values.put("apiKey", settings.getApiKey());
        }
        return builder.encode().buildAndExpand(values).toUri();
    }

    private HttpEntity<Void> createHttpEntity() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return new HttpEntity<>(headers);
    }
}
