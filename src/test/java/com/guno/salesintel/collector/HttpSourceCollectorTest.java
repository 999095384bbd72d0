package com.guno.salesintel.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.config.CollectorProperties.EndpointSettings;
import com.guno.salesintel.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@Slf4j
class HttpSourceCollectorTest {

    private static final String EXPECTED_URL = "https://serpapi.com/search.json?q=Acme&engine=google_news&api_key=secret";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private EndpointSettings settings;
    private HttpSourceCollector collector;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        settings = new EndpointSettings();
        settings.setEnabled(true);
        settings.setBaseUrl("https://serpapi.com/search.json");
        settings.setApiKeyParam("api_key");
        settings.setApiKey("secret");
        settings.getParams().put("engine", "google_news");

        collector = new HttpSourceCollector(SourceType.SERP_NEWS, settings, restTemplate, new ObjectMapper());
    }

    @Test
    void shouldReturnParsedPayload() {
        log.info("Testing HTTP collector success path");
        server.expect(requestTo(EXPECTED_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"news_results\":[{\"title\":\"Acme expands\"}]}", MediaType.APPLICATION_JSON));

        JsonNode payload = collector.collect("Acme");

        assertThat(payload.path("news_results").get(0).path("title").asText()).isEqualTo("Acme expands");
        server.verify();
    }

    @Test
    void shouldWrapServerErrors() {
        server.expect(requestTo(EXPECTED_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> collector.collect("Acme"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("serp_news call failed")
                .extracting("source").isEqualTo(SourceType.SERP_NEWS);
    }

    @Test
    void shouldReturnNullForEmptyBody() {
        server.expect(requestTo(EXPECTED_URL)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertThat(collector.collect("Acme")).isNull();
    }

    @Test
    void shouldRejectMalformedJson() {
        server.expect(requestTo(EXPECTED_URL)).andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> collector.collect("Acme"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    void shouldEncodeCompanyName() {
        URI uri = collector.buildUri("Acme & Co");

        assertThat(uri.getRawQuery()).startsWith("q=Acme%20%26%20Co&engine=google_news");
    }

    @Test
    void shouldCollectCompanyNameWithBraces() {
        URI uri = collector.buildUri("{Acme} Labs+");
        assertThat(uri.getRawQuery()).startsWith("q=%7BAcme%7D%20Labs%2B&engine=google_news");

        server.expect(requestTo(uri))
                .andRespond(withSuccess("{\"news_results\":[]}", MediaType.APPLICATION_JSON));

        JsonNode payload = collector.collect("{Acme} Labs+");

        assertThat(payload.has("news_results")).isTrue();
        server.verify();
    }

    @Test
    void shouldRequireConfigurationAndKeyToBeAvailable() {
        assertThat(collector.isAvailable()).isTrue();

        settings.setApiKey("");
        assertThat(collector.isAvailable()).isFalse();

        settings.setApiKeyParam(null);
        assertThat(collector.isAvailable()).isTrue();

        settings.setEnabled(false);
        assertThat(collector.isAvailable()).isFalse();
    }
}
