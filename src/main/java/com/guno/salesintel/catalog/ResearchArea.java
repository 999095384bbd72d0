package com.guno.salesintel.catalog;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Sub-areas of the research consumer. Each resolves to its own dataset list.
 */
@Getter
@RequiredArgsConstructor
public enum ResearchArea {

    COMPANY_OVERVIEW("company_overview"),
    DECISION_MAKERS("decision_makers"),
    TECH_STACK("tech_stack"),
    BUSINESS_CHALLENGES("business_challenges"),
    COMPETITIVE_POSITIONING_VALUE_PROPS("competitive_positioning_value_props");

    private final String id;

    /**
     * Unknown or missing area ids resolve to {@link #COMPANY_OVERVIEW}.
     */
    public static ResearchArea fromId(String areaId) {
        if (areaId == null) {
            return COMPANY_OVERVIEW;
        }
        return Arrays.stream(values())
                .filter(a -> a.id.equalsIgnoreCase(areaId.trim()) || a.name().equalsIgnoreCase(areaId.trim()))
                .findFirst()
                .orElse(COMPANY_OVERVIEW);
    }
}
