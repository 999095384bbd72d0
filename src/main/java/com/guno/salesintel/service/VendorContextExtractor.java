package com.guno.salesintel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.salesintel.catalog.SourceType;
import com.guno.salesintel.engine.MultiSourceData;
import com.guno.salesintel.planner.VendorContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls vendor attributes out of raw payloads: the search knowledge graph first, then the
 * company enrichment record.
 */
@Component
public class VendorContextExtractor {

    private static final int MAX_ITEMS = 10;

    public VendorContext extract(String vendorCompany, MultiSourceData data, long now) {
        JsonNode knowledgeGraph = path(data.get(SourceType.SERP_ORGANIC), "knowledge_graph");
        JsonNode enrichment = data.get(SourceType.BRIGHTDATA);

        return VendorContext.builder()
                .companyName(vendorCompany)
                .industry(firstText(path(knowledgeGraph, "industry"), path(enrichment, "industry"),
                        path(knowledgeGraph, "type")))
                .products(texts(path(knowledgeGraph, "products"), path(enrichment, "products")))
                .targetMarkets(texts(path(enrichment, "industries"), path(enrichment, "target_markets")))
                .competitors(texts(path(knowledgeGraph, "people_also_search_for"),
                        path(enrichment, "similar_companies"), path(enrichment, "competitors")))
                .valuePropositions(texts(path(enrichment, "specialties")))
                .positioningStrategy(firstText(path(knowledgeGraph, "description"), path(enrichment, "about")))
                .pricingModel(firstText(path(enrichment, "pricing_model")))
                .lastUpdated(now)
                .build();
    }

    private static JsonNode path(JsonNode node, String field) {
        return node != null ? node.path(field) : null;
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            String text = textOf(candidate);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    /**
     * Accepts a string, an array of strings, or an array of objects with a {@code name} or
     * {@code title} field.
     */
    private static List<String> texts(JsonNode... candidates) {
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode candidate : candidates) {
            if (candidate == null || candidate.isMissingNode() || candidate.isNull()) {
                continue;
            }
            if (candidate.isArray()) {
                candidate.forEach(item -> {
                    String text = textOf(item);
                    if (text != null && values.size() < MAX_ITEMS) {
                        values.add(text);
                    }
                });
            } else {
                String text = textOf(candidate);
                if (text != null) {
                    for (String part : text.split(",")) {
                        if (!part.isBlank() && values.size() < MAX_ITEMS) {
                            values.add(part.trim());
                        }
                    }
                }
            }
        }
        return new ArrayList<>(values);
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText().isBlank() ? null : node.asText().trim();
        }
        if (node.isArray()) {
            return node.isEmpty() ? null : textOf(node.get(0));
        }
        if (node.isObject()) {
            String name = textOf(node.get("name"));
            return name != null ? name : textOf(node.get("title"));
        }
        return null;
    }
}
